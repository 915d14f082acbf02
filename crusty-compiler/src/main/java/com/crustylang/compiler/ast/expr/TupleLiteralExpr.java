package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 元组字面量（{@code (a, b)}、{@code ()}、单元素 {@code (a,)}）
 */
public class TupleLiteralExpr extends Expression {
    private final List<Expression> elements;

    public TupleLiteralExpr(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = Collections.unmodifiableList(new ArrayList<Expression>(elements));
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTupleLiteralExpr(this, context);
    }
}
