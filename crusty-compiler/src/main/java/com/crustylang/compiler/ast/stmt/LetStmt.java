package com.crustylang.compiler.ast.stmt;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.expr.Expression;
import com.crustylang.compiler.ast.type.TypeRef;

/**
 * 局部声明。
 *
 * <p>{@code int x = 1;}、{@code let x = 1;}、{@code let x: int = 1;}、
 * {@code var int x = 1;}、{@code const int N = 1;} 都产生此节点。</p>
 */
public class LetStmt extends Statement {
    private final String name;
    private final TypeRef type;          // 可选
    private final Expression initializer; // 可选
    private final Kind kind;

    public LetStmt(SourceLocation location, String name, TypeRef type,
                   Expression initializer, Kind kind) {
        super(location);
        this.name = name;
        this.type = type;
        this.initializer = initializer;
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public boolean hasType() {
        return type != null;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isMutable() {
        return kind == Kind.VAR;
    }

    public boolean isConst() {
        return kind == Kind.CONST;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetStmt(this, context);
    }

    /**
     * 声明种类
     */
    public enum Kind {
        /** 不可变绑定（let 或省略关键字） */
        LET,
        /** 可变绑定 */
        VAR,
        /** 编译期常量 */
        CONST
    }
}
