package com.crustylang.compiler.ast.stmt;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.decl.FunctionDecl;

/**
 * 函数体内声明的嵌套函数，生成为闭包
 */
public class NestedFunctionStmt extends Statement {
    private final FunctionDecl function;

    public NestedFunctionStmt(SourceLocation location, FunctionDecl function) {
        super(location);
        this.function = function;
    }

    public FunctionDecl getFunction() {
        return function;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNestedFunctionStmt(this, context);
    }
}
