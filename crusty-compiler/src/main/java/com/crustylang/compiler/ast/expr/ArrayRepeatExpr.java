package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;

/**
 * 重复数组（{@code [value; count]}）
 */
public class ArrayRepeatExpr extends Expression {
    private final Expression value;
    private final Expression count;

    public ArrayRepeatExpr(SourceLocation location, Expression value, Expression count) {
        super(location);
        this.value = value;
        this.count = count;
    }

    public Expression getValue() {
        return value;
    }

    public Expression getCount() {
        return count;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayRepeatExpr(this, context);
    }
}
