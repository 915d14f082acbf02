package com.crustylang.compiler.ast.stmt;

import com.crustylang.compiler.ast.AstNode;
import com.crustylang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
