package com.crustylang.compiler.codegen;

import com.crustylang.compiler.ast.expr.AssignExpr;
import com.crustylang.compiler.ast.expr.BinaryExpr;
import com.crustylang.compiler.ast.type.PrimitiveKind;
import com.crustylang.compiler.formatter.CrustyStringUtils;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Crusty 到 Rust 的固定语法映射表：原始类型名、运算符优先级、保留字。
 */
public final class HostSyntax {

    private HostSyntax() {}

    // ============ 优先级（数值越大结合越紧） ============

    public static final int PREC_LOWEST = 0;
    public static final int PREC_BLOCK = 1;         // if/块表达式：作为操作数时必须加括号
    public static final int PREC_ASSIGN = 2;
    public static final int PREC_RANGE = 3;
    public static final int PREC_OR = 4;
    public static final int PREC_AND = 5;
    public static final int PREC_COMPARE = 6;
    public static final int PREC_BIT_OR = 7;
    public static final int PREC_BIT_XOR = 8;
    public static final int PREC_BIT_AND = 9;
    public static final int PREC_SHIFT = 10;
    public static final int PREC_ADD = 11;
    public static final int PREC_MUL = 12;
    public static final int PREC_CAST = 13;
    public static final int PREC_UNARY = 14;
    public static final int PREC_POSTFIX = 15;
    public static final int PREC_PRIMARY = 16;

    /** Rust 中该二元运算符的优先级 */
    public static int precedenceOf(BinaryExpr.BinaryOp op) {
        switch (op) {
            case MUL:
            case DIV:
            case MOD:
                return PREC_MUL;
            case ADD:
            case SUB:
                return PREC_ADD;
            case SHL:
            case SHR:
                return PREC_SHIFT;
            case BIT_AND:
                return PREC_BIT_AND;
            case BIT_XOR:
                return PREC_BIT_XOR;
            case BIT_OR:
                return PREC_BIT_OR;
            case EQ:
            case NE:
            case LT:
            case GT:
            case LE:
            case GE:
                return PREC_COMPARE;
            case AND:
                return PREC_AND;
            case OR:
                return PREC_OR;
            default:
                throw new InternalCodegenError("No host precedence for operator " + op, null);
        }
    }

    /** Rust 比较运算符不可结合：{@code a == b == c} 必须加括号 */
    public static boolean isNonAssociative(BinaryExpr.BinaryOp op) {
        return op.isComparison();
    }

    public static String binaryOperator(BinaryExpr.BinaryOp op) {
        return op.toSourceString();
    }

    public static String assignOperator(AssignExpr.AssignOp op) {
        return op.toSourceString();
    }

    // ============ 类型 ============

    public static final String FALLIBLE_ERROR = "Box<dyn std::error::Error>";

    /** 原始类型映射：int→i32、float→f64、void→() */
    public static String primitive(PrimitiveKind kind) {
        switch (kind) {
            case INT:
            case I32:
                return "i32";
            case I64:
                return "i64";
            case U32:
                return "u32";
            case U64:
                return "u64";
            case FLOAT:
            case F64:
                return "f64";
            case F32:
                return "f32";
            case BOOL:
                return "bool";
            case CHAR:
                return "char";
            case VOID:
                return "()";
            default:
                throw new InternalCodegenError("No host type for primitive " + kind, null);
        }
    }

    // ============ 保留字与宏 ============

    private static final Set<String> RUST_KEYWORDS = new HashSet<String>(Arrays.asList(
            "as", "break", "const", "continue", "crate", "else", "enum", "extern", "false", "fn",
            "for", "if", "impl", "in", "let", "loop", "match", "mod", "move", "mut", "pub", "ref",
            "return", "self", "Self", "static", "struct", "super", "trait", "true", "type",
            "unsafe", "use", "where", "while", "async", "await", "dyn", "abstract", "become",
            "box", "do", "final", "macro", "override", "priv", "typeof", "unsized", "virtual",
            "yield", "try"));

    public static boolean isKeyword(String word) {
        return RUST_KEYWORDS.contains(word);
    }

    /**
     * {@code __NAME__} 对应的 Rust 宏名（不含 {@code !}）。与保留字冲突时加 {@code _macro} 后缀。
     */
    public static String macroName(String crustyName) {
        String base = CrustyStringUtils.macroBaseName(crustyName);
        return isKeyword(base) ? base + "_macro" : base;
    }
}
