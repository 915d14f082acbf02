package com.crustylang.compiler.parser;

import com.crustylang.compiler.lexer.Token;

/**
 * 解析异常。解析在第一个错误处停止。
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        super(message);
        this.token = token;
        this.expected = null;
    }

    public ParseException(String message, Token token, String expected) {
        super(message);
        this.token = token;
        this.expected = expected;
    }

    /** 出错位置的 Token（span 由其偏移与词素长度给出） */
    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    /** 实际遇到的内容 */
    public String getFound() {
        return token != null ? token.describe() : null;
    }

    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    /** 不带位置后缀的原始消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            sb.append(" (found ").append(token.describe()).append(")");
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
