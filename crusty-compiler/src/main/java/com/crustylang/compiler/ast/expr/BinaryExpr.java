package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符。precedence 为 Crusty（C 系）优先级，数值越大结合越紧。
     */
    public enum BinaryOp {
        // 逻辑
        OR("||", 4),
        AND("&&", 5),

        // 位运算
        BIT_OR("|", 6),
        BIT_XOR("^", 7),
        BIT_AND("&", 8),

        // 比较
        EQ("==", 9),
        NE("!=", 9),
        LT("<", 10),
        GT(">", 10),
        LE("<=", 10),
        GE(">=", 10),

        // 移位
        SHL("<<", 11),
        SHR(">>", 11),

        // 算术
        ADD("+", 12),
        SUB("-", 12),
        MUL("*", 13),
        DIV("/", 13),
        MOD("%", 13);

        private final String source;
        private final int precedence;

        BinaryOp(String source, int precedence) {
            this.source = source;
            this.precedence = precedence;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public int getPrecedence() {
            return precedence;
        }

        public boolean isComparison() {
            return precedence == 9 || precedence == 10;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }
    }
}
