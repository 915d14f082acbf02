package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 结构体初始化：{@code Point { .x = 1, .y = 2 }}。
 * 省略类型名的 {@code { .x = 1 }} 由声明类型补全（见 {@link #withType(TypeRef)}）。
 */
public class StructInitExpr extends Expression {
    private final TypeRef type;   // 匿名形式为 null
    private final List<FieldInit> fields;

    public StructInitExpr(SourceLocation location, TypeRef type, List<FieldInit> fields) {
        super(location);
        this.type = type;
        this.fields = Collections.unmodifiableList(new ArrayList<FieldInit>(fields));
    }

    public TypeRef getType() {
        return type;
    }

    public boolean hasType() {
        return type != null;
    }

    public List<FieldInit> getFields() {
        return fields;
    }

    /** 用声明类型补全匿名初始化 */
    public StructInitExpr withType(TypeRef declaredType) {
        return new StructInitExpr(location, declaredType, fields);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructInitExpr(this, context);
    }

    /**
     * 字段初始化项
     */
    public static final class FieldInit {
        private final String name;
        private final Expression value;

        public FieldInit(String name, Expression value) {
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }
    }
}
