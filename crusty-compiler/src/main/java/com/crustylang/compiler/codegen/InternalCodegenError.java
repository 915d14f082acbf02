package com.crustylang.compiler.codegen;

import com.crustylang.compiler.ast.SourceLocation;

/**
 * 代码生成内部错误：遇到没有映射规则的结构。
 *
 * <p>属于编译器缺陷而非用户错误，不作为诊断信息报告。</p>
 */
public class InternalCodegenError extends RuntimeException {

    private final SourceLocation location;

    public InternalCodegenError(String message, SourceLocation location) {
        super(location != null ? message + " at " + location : message);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
