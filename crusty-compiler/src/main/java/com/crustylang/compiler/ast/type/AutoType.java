package com.crustylang.compiler.ast.type;

import com.crustylang.compiler.ast.SourceLocation;

/**
 * 推断类型（auto）
 */
public final class AutoType extends TypeRef {

    public AutoType(SourceLocation location) {
        super(location);
    }

    public AutoType() {
        this(null);
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
        return "auto";
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitAuto(this);
    }
}
