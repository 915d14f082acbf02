package com.crustylang.compiler.ast.type;

import com.crustylang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 可失败类型（{@code T?}），值或者错误
 */
public final class FallibleType extends TypeRef {
    private final TypeRef inner;

    public FallibleType(SourceLocation location, TypeRef inner) {
        super(location);
        this.inner = inner;
    }

    public TypeRef getInner() {
        return inner;
    }

    @Override
    public List<TypeRef> getComponents() {
        return Collections.singletonList(inner);
    }

    @Override
    public TypeRef withComponents(List<TypeRef> components) {
        return new FallibleType(location, components.get(0));
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
        return inner.toDisplayString() + "?";
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitFallible(this);
    }
}
