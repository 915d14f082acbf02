package com.crustylang.compiler.ast.stmt;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.expr.Expression;

/**
 * 迭代循环：{@code for (x in iterable) { ... }}
 */
public class ForInStmt extends LoopStatement {
    private final String variable;
    private final Expression iterable;

    public ForInStmt(SourceLocation location, String label, String variable,
                     Expression iterable, Block body) {
        super(location, label, body);
        this.variable = variable;
        this.iterable = iterable;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getIterable() {
        return iterable;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForInStmt(this, context);
    }
}
