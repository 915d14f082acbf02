package com.crustylang.compiler.ast.type;

import com.crustylang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 定长数组类型（{@code T[N]}）
 */
public final class ArrayType extends TypeRef {
    private final TypeRef element;
    private final long size;

    public ArrayType(SourceLocation location, TypeRef element, long size) {
        super(location);
        this.element = element;
        this.size = size;
    }

    public TypeRef getElement() {
        return element;
    }

    public long getSize() {
        return size;
    }

    @Override
    public List<TypeRef> getComponents() {
        return Collections.singletonList(element);
    }

    @Override
    public TypeRef withComponents(List<TypeRef> components) {
        return new ArrayType(location, components.get(0), size);
    }

    @Override
    public boolean shallowEquals(TypeRef other) {
        return size == ((ArrayType) other).size;
    }

    @Override
    protected int shallowHash() {
        return Long.hashCode(size);
    }

    @Override
    public String toDisplayString() {
        return element.toDisplayString() + "[" + size + "]";
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitArray(this);
    }
}
