package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;

/**
 * 范围（{@code a..b}、{@code a..=b}、{@code ..b}、{@code a..}），只出现在索引与 for-in 中
 */
public class RangeExpr extends Expression {
    private final Expression start;  // 可选
    private final Expression end;    // 可选
    private final boolean inclusive;

    public RangeExpr(SourceLocation location, Expression start, Expression end, boolean inclusive) {
        super(location);
        this.start = start;
        this.end = end;
        this.inclusive = inclusive;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getEnd() {
        return end;
    }

    public boolean isInclusive() {
        return inclusive;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRangeExpr(this, context);
    }
}
