package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 类型作用域调用：{@code @Vec.new()}、显式泛型 {@code @Vec(int).new()}
 */
public class TypeScopedCallExpr extends Expression {
    private final TypeRef type;
    private final List<TypeRef> typeArgs;
    private final String methodName;
    private final List<Expression> args;

    public TypeScopedCallExpr(SourceLocation location, TypeRef type, List<TypeRef> typeArgs,
                              String methodName, List<Expression> args) {
        super(location);
        this.type = type;
        this.typeArgs = Collections.unmodifiableList(new ArrayList<TypeRef>(typeArgs));
        this.methodName = methodName;
        this.args = Collections.unmodifiableList(new ArrayList<Expression>(args));
    }

    public TypeRef getType() {
        return type;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    public boolean hasTypeArgs() {
        return !typeArgs.isEmpty();
    }

    public String getMethodName() {
        return methodName;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeScopedCallExpr(this, context);
    }
}
