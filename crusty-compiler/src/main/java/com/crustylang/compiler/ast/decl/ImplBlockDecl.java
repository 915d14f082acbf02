package com.crustylang.compiler.ast.decl;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.Visibility;
import com.crustylang.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 方法块：{@code typedef struct { ... } @Type;} 或带后缀名的 {@code @Type.suffix}
 */
public final class ImplBlockDecl extends Item {
    private final TypeRef targetType;
    private final String blockName;     // 可选
    private final List<FunctionDecl> methods;

    public ImplBlockDecl(SourceLocation location, List<Attribute> attributes, TypeRef targetType,
                         String blockName, List<FunctionDecl> methods) {
        super(location, attributes, Visibility.PUBLIC);
        this.targetType = targetType;
        this.blockName = blockName;
        this.methods = Collections.unmodifiableList(new ArrayList<FunctionDecl>(methods));
    }

    @Override
    public String getName() {
        return blockName != null
                ? targetType.toDisplayString() + "." + blockName
                : targetType.toDisplayString();
    }

    public TypeRef getTargetType() {
        return targetType;
    }

    public String getBlockName() {
        return blockName;
    }

    public List<FunctionDecl> getMethods() {
        return methods;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImplBlockDecl(this, context);
    }
}
