package com.crustylang.compiler.ast.stmt;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;

/**
 * 无条件循环（{@code loop { ... }}）
 */
public class LoopStmt extends LoopStatement {

    public LoopStmt(SourceLocation location, String label, Block body) {
        super(location, label, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLoopStmt(this, context);
    }
}
