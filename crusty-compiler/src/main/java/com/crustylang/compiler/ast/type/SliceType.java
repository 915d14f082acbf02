package com.crustylang.compiler.ast.type;

import com.crustylang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 切片类型（{@code T[]}）
 */
public final class SliceType extends TypeRef {
    private final TypeRef element;

    public SliceType(SourceLocation location, TypeRef element) {
        super(location);
        this.element = element;
    }

    public TypeRef getElement() {
        return element;
    }

    @Override
    public List<TypeRef> getComponents() {
        return Collections.singletonList(element);
    }

    @Override
    public TypeRef withComponents(List<TypeRef> components) {
        return new SliceType(location, components.get(0));
    }

    @Override
    public boolean shallowEquals(TypeRef other) {
        return true;
    }

    @Override
    protected int shallowHash() {
        return 0;
    }

    @Override
    public String toDisplayString() {
        return element.toDisplayString() + "[]";
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitSlice(this);
    }
}
