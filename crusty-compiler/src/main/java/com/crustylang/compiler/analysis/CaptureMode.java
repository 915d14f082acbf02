package com.crustylang.compiler.analysis;

/**
 * 嵌套函数对外层变量的捕获方式
 */
public enum CaptureMode {
    /** 只读 */
    READ_ONLY,
    /** 在嵌套函数体内被赋值或取可变引用 */
    MUTABLE,
    /** 按值传给调用且外层之后不再读取 */
    MOVE
}
