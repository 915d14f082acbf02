package com.crustylang.compiler.ast.stmt;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.expr.Expression;

/**
 * While 循环
 */
public class WhileStmt extends LoopStatement {
    private final Expression condition;

    public WhileStmt(SourceLocation location, String label, Expression condition, Block body) {
        super(location, label, body);
        this.condition = condition;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }
}
