package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.type.TypeRef;

/**
 * sizeof(Type)
 */
public class SizeofExpr extends Expression {
    private final TypeRef type;

    public SizeofExpr(SourceLocation location, TypeRef type) {
        super(location);
        this.type = type;
    }

    public TypeRef getType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSizeofExpr(this, context);
    }
}
