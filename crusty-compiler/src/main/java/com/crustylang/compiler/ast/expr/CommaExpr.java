package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 逗号表达式（{@code a, b}），值为最后一项
 */
public class CommaExpr extends Expression {
    private final List<Expression> expressions;

    public CommaExpr(SourceLocation location, List<Expression> expressions) {
        super(location);
        this.expressions = Collections.unmodifiableList(new ArrayList<Expression>(expressions));
    }

    public List<Expression> getExpressions() {
        return expressions;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCommaExpr(this, context);
    }
}
