package com.crustylang.compiler.formatter;

/**
 * 源码输出配置（格式化器与代码生成器共用）
 */
public class FormatConfig {
    private int indentSize = 4;
    private boolean useSpaces = true;

    public FormatConfig() {
    }

    public FormatConfig(int indentSize, boolean useSpaces) {
        setIndentSize(indentSize);
        this.useSpaces = useSpaces;
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("Indent size must not be negative: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }
}
