package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 数组字面量（{@code [a, b, c]}）
 */
public class ArrayLiteralExpr extends Expression {
    private final List<Expression> elements;

    public ArrayLiteralExpr(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = Collections.unmodifiableList(new ArrayList<Expression>(elements));
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayLiteralExpr(this, context);
    }
}
