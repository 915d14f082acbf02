package com.crustylang.compiler.lexer;

/**
 * Crusty 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    FLOAT_LITERAL,
    CHAR_LITERAL,
    STRING_LITERAL,

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 声明 ===
    KW_LET, KW_VAR, KW_CONST, KW_STATIC,
    KW_STRUCT, KW_ENUM, KW_TYPEDEF, KW_EXTERN,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELSE, KW_WHILE, KW_FOR, KW_IN, KW_LOOP,
    KW_RETURN, KW_BREAK, KW_CONTINUE,
    KW_SWITCH, KW_CASE, KW_DEFAULT,

    // === 关键词 - 内置类型 ===
    KW_INT, KW_I32, KW_I64, KW_U32, KW_U64,
    KW_FLOAT, KW_F32, KW_F64,
    KW_BOOL, KW_CHAR, KW_VOID, KW_AUTO,

    // === 关键词 - 特殊 ===
    KW_TRUE, KW_FALSE, KW_NULL, KW_SELF, KW_SIZEOF,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    STAR,           // *
    SLASH,          // /
    PERCENT,        // %
    INC,            // ++
    DEC,            // --

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 逻辑 ===
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // === 操作符 - 位运算 ===
    AMP,            // &
    PIPE,           // |
    CARET,          // ^
    TILDE,          // ~
    SHL,            // <<
    SHR,            // >>

    // === 操作符 - 赋值 ===
    ASSIGN,         // =
    PLUS_ASSIGN,    // +=
    MINUS_ASSIGN,   // -=
    MUL_ASSIGN,     // *=
    DIV_ASSIGN,     // /=
    MOD_ASSIGN,     // %=
    AND_ASSIGN,     // &=
    OR_ASSIGN,      // |=
    XOR_ASSIGN,     // ^=
    SHL_ASSIGN,     // <<=
    SHR_ASSIGN,     // >>=

    // === 操作符 - 特殊 ===
    QUESTION,       // ?
    RANGE,          // ..
    RANGE_INCLUSIVE,// ..=
    DOUBLE_COLON,   // ::
    ARROW,          // ->
    AT,             // @
    HASH,           // #

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    LBRACKET,       // [
    RBRACKET,       // ]
    COMMA,          // ,
    DOT,            // .
    COLON,          // :
    SEMICOLON,      // ;

    // === 特殊 ===
    EOF,
    ERROR;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为内置原始类型关键词
     */
    public boolean isPrimitiveType() {
        switch (this) {
            case KW_INT:
            case KW_I32:
            case KW_I64:
            case KW_U32:
            case KW_U64:
            case KW_FLOAT:
            case KW_F32:
            case KW_F64:
            case KW_BOOL:
            case KW_CHAR:
            case KW_VOID:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为赋值操作符
     */
    public boolean isAssignmentOp() {
        switch (this) {
            case ASSIGN:
            case PLUS_ASSIGN:
            case MINUS_ASSIGN:
            case MUL_ASSIGN:
            case DIV_ASSIGN:
            case MOD_ASSIGN:
            case AND_ASSIGN:
            case OR_ASSIGN:
            case XOR_ASSIGN:
            case SHL_ASSIGN:
            case SHR_ASSIGN:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为字面量
     */
    public boolean isLiteral() {
        switch (this) {
            case INT_LITERAL:
            case FLOAT_LITERAL:
            case CHAR_LITERAL:
            case STRING_LITERAL:
            case KW_TRUE:
            case KW_FALSE:
            case KW_NULL:
                return true;
            default:
                return false;
        }
    }
}
