package com.crustylang.compiler.compiler;

import com.crustylang.compiler.formatter.FormatConfig;

import java.io.PrintStream;

/**
 * 编译选项
 */
public class CompilerOptions {

    /**
     * 输出形式
     */
    public enum EmitMode {
        /** Rust 源码 */
        RUST,
        /** 分析后的语法树 */
        AST,
        /** 规范格式的 Crusty 源码 */
        CRUSTY
    }

    private EmitMode emitMode = EmitMode.RUST;
    private String unitName = "<input>";
    private FormatConfig formatConfig = new FormatConfig();
    private PrintStream errStream = System.err;

    public EmitMode getEmitMode() {
        return emitMode;
    }

    public CompilerOptions setEmitMode(EmitMode emitMode) {
        this.emitMode = emitMode;
        return this;
    }

    public String getUnitName() {
        return unitName;
    }

    public CompilerOptions setUnitName(String unitName) {
        this.unitName = unitName;
        return this;
    }

    public FormatConfig getFormatConfig() {
        return formatConfig;
    }

    public CompilerOptions setFormatConfig(FormatConfig formatConfig) {
        this.formatConfig = formatConfig;
        return this;
    }

    /** 词法错误的输出流 */
    public PrintStream getErrStream() {
        return errStream;
    }

    public CompilerOptions setErrStream(PrintStream errStream) {
        this.errStream = errStream;
        return this;
    }
}
