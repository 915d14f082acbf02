package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;

/**
 * 错误传播（{@code expr?}）
 */
public class ErrorPropagationExpr extends Expression {
    private final Expression operand;

    public ErrorPropagationExpr(SourceLocation location, Expression operand) {
        super(location);
        this.operand = operand;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitErrorPropagationExpr(this, context);
    }
}
