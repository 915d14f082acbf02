package com.crustylang.compiler.ast.stmt;

import com.crustylang.compiler.ast.SourceLocation;

/**
 * 可带标签的循环语句（while / loop / for / for-in）
 */
public abstract class LoopStatement extends Statement {
    protected final String label;   // 可选，源码中写作 .label:
    protected final Block body;

    protected LoopStatement(SourceLocation location, String label, Block body) {
        super(location);
        this.label = label;
        this.body = body;
    }

    public String getLabel() {
        return label;
    }

    public boolean hasLabel() {
        return label != null;
    }

    public Block getBody() {
        return body;
    }
}
