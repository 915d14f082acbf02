package com.crustylang.compiler.ast.type;

import com.crustylang.compiler.ast.SourceLocation;

/**
 * 原始类型（int, float, bool, void ...）
 */
public final class PrimitiveType extends TypeRef {
    private final PrimitiveKind kind;

    public PrimitiveType(SourceLocation location, PrimitiveKind kind) {
        super(location);
        this.kind = kind;
    }

    public PrimitiveType(PrimitiveKind kind) {
        this(null, kind);
    }

    public PrimitiveKind getKind() {
        return kind;
    }

    public boolean isVoid() {
        return kind == PrimitiveKind.VOID;
    }

    @Override
    public boolean shallowEquals(TypeRef other) {
        return kind == ((PrimitiveType) other).kind;
    }

    @Override
    protected int shallowHash() {
        return kind.ordinal();
    }

    @Override
    public String toDisplayString() {
        return kind.getSourceName();
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitPrimitive(this);
    }
}
