package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;

/**
 * 字面量。数字保留源码文本（十六进制、下划线分隔），直接透传。
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;
    private final String text;

    public Literal(SourceLocation location, Object value, LiteralKind kind, String text) {
        super(location);
        this.value = value;
        this.kind = kind;
        this.text = text;
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    /** 源码文本（字符串/字符字面量包含引号） */
    public String getText() {
        return text;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT,
        FLOAT,
        CHAR,
        STRING,
        BOOLEAN,
        NULL
    }
}
