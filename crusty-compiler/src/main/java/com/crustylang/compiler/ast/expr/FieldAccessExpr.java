package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;

/**
 * 字段访问（{@code a.b}、元组下标 {@code t.0}）。{@code p->f} 解析为 {@code (*p).f}。
 */
public class FieldAccessExpr extends Expression {
    private final Expression target;
    private final String field;

    public FieldAccessExpr(SourceLocation location, Expression target, String field) {
        super(location);
        this.target = target;
        this.field = field;
    }

    public Expression getTarget() {
        return target;
    }

    public String getField() {
        return field;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldAccessExpr(this, context);
    }
}
