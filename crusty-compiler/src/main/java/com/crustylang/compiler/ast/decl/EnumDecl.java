package com.crustylang.compiler.ast.decl;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.Visibility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 枚举声明（C 风格，成员值自增）
 */
public final class EnumDecl extends Item {
    private final String name;
    private final List<EnumVariant> variants;

    public EnumDecl(SourceLocation location, List<Attribute> attributes, Visibility visibility,
                    String name, List<EnumVariant> variants) {
        super(location, attributes, visibility);
        this.name = name;
        this.variants = Collections.unmodifiableList(new ArrayList<EnumVariant>(variants));
    }

    @Override
    public String getName() {
        return name;
    }

    public List<EnumVariant> getVariants() {
        return variants;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumDecl(this, context);
    }
}
