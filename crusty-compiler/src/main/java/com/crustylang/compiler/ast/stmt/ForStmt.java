package com.crustylang.compiler.ast.stmt;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.expr.Expression;

/**
 * C 风格 for 循环：{@code for (init; cond; update) { ... }}，三部分均可省略
 */
public class ForStmt extends LoopStatement {
    private final Statement initializer;  // LetStmt 或 ExpressionStmt
    private final Expression condition;
    private final Expression update;

    public ForStmt(SourceLocation location, String label, Statement initializer,
                   Expression condition, Expression update, Block body) {
        super(location, label, body);
        this.initializer = initializer;
        this.condition = condition;
        this.update = update;
    }

    public Statement getInitializer() {
        return initializer;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getUpdate() {
        return update;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
