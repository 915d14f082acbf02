package com.crustylang.compiler.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次编译的结果：生成的文本或诊断列表，二者只有其一
 */
public final class CompilationResult {

    private final String output;
    private final List<Diagnostic> diagnostics;

    private CompilationResult(String output, List<Diagnostic> diagnostics) {
        this.output = output;
        this.diagnostics = diagnostics;
    }

    static CompilationResult success(String output) {
        return new CompilationResult(output, Collections.<Diagnostic>emptyList());
    }

    static CompilationResult failure(List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            throw new IllegalArgumentException("A failed compilation needs at least one diagnostic");
        }
        return new CompilationResult(null, Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics)));
    }

    public boolean isSuccess() {
        return output != null;
    }

    /** 生成的文本；失败时为 null */
    public String getOutput() {
        return output;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
