package com.crustylang.compiler.ast.decl;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.Visibility;
import com.crustylang.compiler.ast.expr.Expression;
import com.crustylang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 顶层常量（{@code const int MAX = 10;}）
 */
public final class ConstDecl extends Item {
    private final String name;
    private final TypeRef type;
    private final Expression value;

    public ConstDecl(SourceLocation location, List<Attribute> attributes, Visibility visibility,
                     String name, TypeRef type, Expression value) {
        super(location, attributes, visibility);
        this.name = name;
        this.type = type;
        this.value = value;
    }

    @Override
    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConstDecl(this, context);
    }
}
