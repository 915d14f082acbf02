package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.type.TypeRef;

/**
 * C 风格类型转换（{@code (Type) operand}）
 */
public class CastExpr extends Expression {
    private final TypeRef targetType;
    private final Expression operand;

    public CastExpr(SourceLocation location, TypeRef targetType, Expression operand) {
        super(location);
        this.targetType = targetType;
        this.operand = operand;
    }

    public TypeRef getTargetType() {
        return targetType;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCastExpr(this, context);
    }
}
