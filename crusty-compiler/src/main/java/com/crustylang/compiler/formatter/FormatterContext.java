package com.crustylang.compiler.formatter;

/**
 * 输出上下文，跟踪输出缓冲区和缩进层级
 */
public class FormatterContext {
    private final StringBuilder output = new StringBuilder();
    private final FormatConfig config;
    private final String indentUnit;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public FormatterContext(FormatConfig config) {
        this.config = config;
        this.indentUnit = config.getIndentString();
    }

    public FormatConfig getConfig() {
        return config;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            for (int i = 0; i < indentLevel; i++) {
                output.append(indentUnit);
            }
            atLineStart = false;
        }
        output.append(text);
    }

    /**
     * 追加一整行
     */
    public void line(String text) {
        append(text);
        newLine();
    }

    /**
     * 换行
     */
    public void newLine() {
        output.append("\n");
        atLineStart = true;
    }

    /**
     * 追加空行，不产生连续空行
     */
    public void blankLine() {
        int length = output.length();
        if (length == 0) {
            return;
        }
        if (length >= 2 && output.charAt(length - 1) == '\n' && output.charAt(length - 2) == '\n') {
            return;
        }
        if (output.charAt(length - 1) != '\n') {
            output.append("\n");
        }
        output.append("\n");
        atLineStart = true;
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return output.toString();
    }
}
