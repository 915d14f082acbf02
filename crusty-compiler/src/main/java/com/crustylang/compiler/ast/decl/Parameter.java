package com.crustylang.compiler.ast.decl;

import com.crustylang.compiler.ast.AstNode;
import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.type.TypeRef;

/**
 * 函数参数。方法接收者（self / &self / &var self）没有显式类型。
 */
public final class Parameter extends AstNode {
    private final String name;
    private final TypeRef type;
    private final SelfKind selfKind;

    public Parameter(SourceLocation location, String name, TypeRef type) {
        this(location, name, type, SelfKind.NONE);
    }

    private Parameter(SourceLocation location, String name, TypeRef type, SelfKind selfKind) {
        super(location);
        this.name = name;
        this.type = type;
        this.selfKind = selfKind;
    }

    public static Parameter receiver(SourceLocation location, SelfKind kind) {
        return new Parameter(location, "self", null, kind);
    }

    public String getName() {
        return name;
    }

    /** 接收者返回 null */
    public TypeRef getType() {
        return type;
    }

    public SelfKind getSelfKind() {
        return selfKind;
    }

    public boolean isReceiver() {
        return selfKind != SelfKind.NONE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }

    /**
     * 接收者形式
     */
    public enum SelfKind {
        NONE(""),
        VALUE("self"),
        REF("&self"),
        REF_MUT("&var self");

        private final String source;

        SelfKind(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }
    }
}
