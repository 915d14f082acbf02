package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstNode;
import com.crustylang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
