package com.crustylang.compiler.ast.decl;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.Visibility;
import com.crustylang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 类型别名（{@code typedef Target Name;}）
 */
public final class TypedefDecl extends Item {
    private final String name;
    private final TypeRef target;

    public TypedefDecl(SourceLocation location, List<Attribute> attributes, Visibility visibility,
                       String name, TypeRef target) {
        super(location, attributes, visibility);
        this.name = name;
        this.target = target;
    }

    @Override
    public String getName() {
        return name;
    }

    public TypeRef getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypedefDecl(this, context);
    }
}
