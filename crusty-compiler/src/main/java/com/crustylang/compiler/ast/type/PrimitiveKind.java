package com.crustylang.compiler.ast.type;

/**
 * 内置原始类型
 */
public enum PrimitiveKind {
    INT("int"),
    I32("i32"),
    I64("i64"),
    U32("u32"),
    U64("u64"),
    FLOAT("float"),
    F32("f32"),
    F64("f64"),
    BOOL("bool"),
    CHAR("char"),
    VOID("void");

    private final String sourceName;

    PrimitiveKind(String sourceName) {
        this.sourceName = sourceName;
    }

    /** Crusty 源码中的关键字 */
    public String getSourceName() {
        return sourceName;
    }

    public boolean isInteger() {
        switch (this) {
            case INT:
            case I32:
            case I64:
            case U32:
            case U64:
                return true;
            default:
                return false;
        }
    }

    public boolean isFloatingPoint() {
        return this == FLOAT || this == F32 || this == F64;
    }

    public boolean isNumeric() {
        return isInteger() || isFloatingPoint();
    }
}
