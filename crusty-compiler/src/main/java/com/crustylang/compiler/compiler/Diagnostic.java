package com.crustylang.compiler.compiler;

import com.crustylang.compiler.analysis.SemanticError;
import com.crustylang.compiler.lexer.TokenType;
import com.crustylang.compiler.parser.ParseException;

/**
 * 编译诊断条目。语法错误与语义错误统一为同一形式。
 */
public final class Diagnostic {

    public enum Stage {
        LEXICAL, SYNTAX, SEMANTIC
    }

    private final Stage stage;
    private final String kind;
    private final String message;
    private final int line;
    private final int column;

    public Diagnostic(Stage stage, String kind, String message, int line, int column) {
        this.stage = stage;
        this.kind = kind;
        this.message = message;
        this.line = line;
        this.column = column;
    }

    static Diagnostic fromParseException(ParseException e) {
        boolean lexical = e.getToken() != null && e.getToken().getType() == TokenType.ERROR;
        StringBuilder message = new StringBuilder(e.getRawMessage());
        if (e.getFound() != null && !lexical) {
            message.append(" (found ").append(e.getFound()).append(")");
        }
        if (e.getExpected() != null) {
            message.append(", expected: ").append(e.getExpected());
        }
        return new Diagnostic(lexical ? Stage.LEXICAL : Stage.SYNTAX,
                lexical ? "LEXICAL_ERROR" : "SYNTAX_ERROR",
                message.toString(), e.getLine(), e.getColumn());
    }

    static Diagnostic fromSemanticError(SemanticError error) {
        return new Diagnostic(Stage.SEMANTIC, error.getKind().name(), error.getMessage(),
                error.getLocation().getLine(), error.getLocation().getColumn());
    }

    public Stage getStage() { return stage; }
    public String getKind() { return kind; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    @Override
    public String toString() {
        return line + ":" + column + ": " + kind + ": " + message;
    }
}
