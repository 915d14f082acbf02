package com.crustylang.compiler.ast.stmt;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Switch 语句（不支持贯穿，分支末尾的 break 在解析时去掉）
 */
public class SwitchStmt extends Statement {
    private final Expression subject;
    private final List<SwitchCase> cases;
    private final Block defaultBranch;  // 可选

    public SwitchStmt(SourceLocation location, Expression subject,
                      List<SwitchCase> cases, Block defaultBranch) {
        super(location);
        this.subject = subject;
        this.cases = Collections.unmodifiableList(new ArrayList<SwitchCase>(cases));
        this.defaultBranch = defaultBranch;
    }

    public Expression getSubject() {
        return subject;
    }

    public List<SwitchCase> getCases() {
        return cases;
    }

    public Block getDefaultBranch() {
        return defaultBranch;
    }

    public boolean hasDefault() {
        return defaultBranch != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSwitchStmt(this, context);
    }
}
