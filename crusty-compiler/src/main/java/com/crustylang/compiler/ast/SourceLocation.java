package com.crustylang.compiler.ast;

/**
 * 源码位置信息（起始行列 + 字符偏移 + 长度，构成一个 span）
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int offset;
    private final int length;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0, 0);

    public SourceLocation(String file, int line, int column, int offset, int length) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.length = length;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public int getLength() {
        return length;
    }

    public int getEndOffset() {
        return offset + length;
    }

    /** 合并两个位置为覆盖二者的 span（要求同一文件） */
    public SourceLocation to(SourceLocation end) {
        if (end == null || end == UNKNOWN || this == UNKNOWN) {
            return this;
        }
        int endOffset = Math.max(getEndOffset(), end.getEndOffset());
        return new SourceLocation(file, line, column, offset, endOffset - offset);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
