package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 方法调用（{@code receiver.method(args)}）
 */
public class MethodCallExpr extends Expression {
    private final Expression receiver;
    private final String methodName;
    private final List<Expression> args;

    public MethodCallExpr(SourceLocation location, Expression receiver, String methodName,
                          List<Expression> args) {
        super(location);
        this.receiver = receiver;
        this.methodName = methodName;
        this.args = Collections.unmodifiableList(new ArrayList<Expression>(args));
    }

    public Expression getReceiver() {
        return receiver;
    }

    public String getMethodName() {
        return methodName;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMethodCallExpr(this, context);
    }
}
