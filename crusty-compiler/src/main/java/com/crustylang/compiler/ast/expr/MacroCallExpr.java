package com.crustylang.compiler.ast.expr;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 宏调用（{@code __println__("x = {}", x)}），名字保留双下划线形式
 */
public class MacroCallExpr extends Expression {
    private final String name;
    private final Delimiter delimiter;
    private final List<Expression> args;

    public MacroCallExpr(SourceLocation location, String name, Delimiter delimiter,
                         List<Expression> args) {
        super(location);
        this.name = name;
        this.delimiter = delimiter;
        this.args = Collections.unmodifiableList(new ArrayList<Expression>(args));
    }

    public String getName() {
        return name;
    }

    public Delimiter getDelimiter() {
        return delimiter;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMacroCallExpr(this, context);
    }

    /**
     * 宏参数的括号种类
     */
    public enum Delimiter {
        PAREN("(", ")"),
        BRACKET("[", "]"),
        BRACE("{", "}");

        private final String open;
        private final String close;

        Delimiter(String open, String close) {
            this.open = open;
            this.close = close;
        }

        public String getOpen() {
            return open;
        }

        public String getClose() {
            return close;
        }
    }
}
