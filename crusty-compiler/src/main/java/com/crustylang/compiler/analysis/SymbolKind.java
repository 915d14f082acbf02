package com.crustylang.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    VARIABLE,           // let/var/const 局部变量
    PARAMETER,          // 函数参数
    FUNCTION,           // 顶层函数
    NESTED_FUNCTION,    // 函数内嵌套函数（闭包）
    EXTERN_FUNCTION,    // extern 块中的签名
    CONSTANT,           // 顶层 const
    STRUCT,             // struct 声明
    ENUM,               // enum 声明
    TYPE_ALIAS,         // typedef
    MACRO               // #define
}
