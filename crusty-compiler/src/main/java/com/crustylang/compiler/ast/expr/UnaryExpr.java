package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;

/**
 * 前缀一元表达式（不存在后缀自增/自减）
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, UnaryOp operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        NEG("-"),
        NOT("!"),
        BIT_NOT("~"),
        REF("&"),
        REF_MUT("&var "),
        DEREF("*"),
        PRE_INC("++"),
        PRE_DEC("--");

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        /** 是否修改操作数 */
        public boolean isMutating() {
            return this == PRE_INC || this == PRE_DEC || this == REF_MUT;
        }
    }
}
