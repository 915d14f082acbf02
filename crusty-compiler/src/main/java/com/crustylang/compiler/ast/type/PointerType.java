package com.crustylang.compiler.ast.type;

import com.crustylang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 裸指针类型（{@code *T}、{@code *var T}、后缀形式 {@code T*}）
 */
public final class PointerType extends TypeRef {
    private final TypeRef inner;
    private final boolean mutable;

    public PointerType(SourceLocation location, TypeRef inner, boolean mutable) {
        super(location);
        this.inner = inner;
        this.mutable = mutable;
    }

    public TypeRef getInner() {
        return inner;
    }

    public boolean isMutable() {
        return mutable;
    }

    @Override
    public List<TypeRef> getComponents() {
        return Collections.singletonList(inner);
    }

    @Override
    public TypeRef withComponents(List<TypeRef> components) {
        return new PointerType(location, components.get(0), mutable);
    }

    @Override
    public boolean shallowEquals(TypeRef other) {
        return mutable == ((PointerType) other).mutable;
    }

    @Override
    protected int shallowHash() {
        return mutable ? 1 : 0;
    }

    @Override
    public String toDisplayString() {
        return (mutable ? "*var " : "*") + inner.toDisplayString();
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitPointer(this);
    }
}
