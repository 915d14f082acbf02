package com.crustylang.compiler.lexer;

import com.crustylang.compiler.formatter.CrustyStringUtils;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Crusty 词法分析器
 *
 * <p>空白与换行不产生 Token，行号保存在每个 Token 上（{@code #define} 依赖行号确定宏体范围）。
 * 词法错误输出到 errStream 并生成 {@link TokenType#ERROR}，由语法分析器转为解析异常。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<Token>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int errorCount = 0;

    private final PrintStream errStream;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<String, TokenType>();

        // 声明
        map.put("let", TokenType.KW_LET);
        map.put("var", TokenType.KW_VAR);
        map.put("const", TokenType.KW_CONST);
        map.put("static", TokenType.KW_STATIC);
        map.put("struct", TokenType.KW_STRUCT);
        map.put("enum", TokenType.KW_ENUM);
        map.put("typedef", TokenType.KW_TYPEDEF);
        map.put("extern", TokenType.KW_EXTERN);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("while", TokenType.KW_WHILE);
        map.put("for", TokenType.KW_FOR);
        map.put("in", TokenType.KW_IN);
        map.put("loop", TokenType.KW_LOOP);
        map.put("return", TokenType.KW_RETURN);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("switch", TokenType.KW_SWITCH);
        map.put("case", TokenType.KW_CASE);
        map.put("default", TokenType.KW_DEFAULT);

        // 内置类型
        map.put("int", TokenType.KW_INT);
        map.put("i32", TokenType.KW_I32);
        map.put("i64", TokenType.KW_I64);
        map.put("u32", TokenType.KW_U32);
        map.put("u64", TokenType.KW_U64);
        map.put("float", TokenType.KW_FLOAT);
        map.put("f32", TokenType.KW_F32);
        map.put("f64", TokenType.KW_F64);
        map.put("bool", TokenType.KW_BOOL);
        map.put("char", TokenType.KW_CHAR);
        map.put("void", TokenType.KW_VOID);
        map.put("auto", TokenType.KW_AUTO);

        // 特殊
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("NULL", TokenType.KW_NULL);
        map.put("self", TokenType.KW_SELF);
        map.put("sizeof", TokenType.KW_SIZEOF);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this(source, fileName, System.err);
    }

    public Lexer(String source, String fileName, PrintStream errStream) {
        this.source = source;
        this.fileName = fileName;
        this.errStream = errStream;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /** 已报告的词法错误数 */
    public int getErrorCount() {
        return errorCount;
    }

    /**
     * 获取下一个 Token（流式接口）
     *
     * @return 下一个 Token，输入结束后持续返回 EOF
     */
    public Token nextToken() {
        while (true) {
            skipWhitespace();

            if (isAtEnd()) {
                return new Token(TokenType.EOF, "", null, line, column, current);
            }

            start = current;
            scanToken();

            // 注释不生成 token，继续扫描
            if (!tokens.isEmpty()) {
                return tokens.remove(tokens.size() - 1);
            }
        }
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> result = new ArrayList<Token>();
        Token token;
        do {
            token = nextToken();
            result.add(token);
        } while (token.getType() != TokenType.EOF);
        return result;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '\n') {
                advance();
                newLine();
            } else {
                break;
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '@': addToken(TokenType.AT); break;
            case '#': addToken(TokenType.HASH); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '~': addToken(TokenType.TILDE); break;

            // 可能是多字符的 Token
            case '.':
                if (match('.')) {
                    addToken(match('=') ? TokenType.RANGE_INCLUSIVE : TokenType.RANGE);
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case ':':
                addToken(match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON);
                break;

            case '+':
                if (match('+')) addToken(TokenType.INC);
                else if (match('=')) addToken(TokenType.PLUS_ASSIGN);
                else addToken(TokenType.PLUS);
                break;

            case '-':
                if (match('-')) addToken(TokenType.DEC);
                else if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else if (match('>')) addToken(TokenType.ARROW);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                addToken(match('=') ? TokenType.MUL_ASSIGN : TokenType.STAR);
                break;

            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    // 多行注释
                    blockComment();
                } else if (match('=')) {
                    addToken(TokenType.DIV_ASSIGN);
                } else {
                    addToken(TokenType.SLASH);
                }
                break;

            case '%':
                addToken(match('=') ? TokenType.MOD_ASSIGN : TokenType.PERCENT);
                break;

            case '^':
                addToken(match('=') ? TokenType.XOR_ASSIGN : TokenType.CARET);
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                if (match('<')) {
                    addToken(match('=') ? TokenType.SHL_ASSIGN : TokenType.SHL);
                } else {
                    addToken(match('=') ? TokenType.LE : TokenType.LT);
                }
                break;

            case '>':
                // '>>' 在泛型闭合处由语法分析器拆分
                if (match('>')) {
                    addToken(match('=') ? TokenType.SHR_ASSIGN : TokenType.SHR);
                } else {
                    addToken(match('=') ? TokenType.GE : TokenType.GT);
                }
                break;

            case '&':
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    addToken(match('=') ? TokenType.AND_ASSIGN : TokenType.AMP);
                }
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    addToken(match('=') ? TokenType.OR_ASSIGN : TokenType.PIPE);
                }
                break;

            // 字符串
            case '"':
                string();
                break;

            // 字符
            case '\'':
                character();
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        int tokenColumn = column - (current - start);
        tokens.add(new Token(type, lexeme, literal, line, tokenColumn, start));
    }

    // === 复杂 Token 扫描 ===

    private void string() {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') {
                error("Unterminated string");
                return;
            }
            if (peek() == '\\') {
                advance();
                value.append(escapeChar());
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }

        advance(); // 闭合的 "
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private char escapeChar() {
        if (isAtEnd()) {
            error("Unterminated escape sequence");
            return '\0';
        }
        char c = advance();
        int result = CrustyStringUtils.unescapeChar(c);
        if (result < 0) {
            error("Invalid escape character: \\" + c);
            return c;
        }
        return (char) result;
    }

    private void character() {
        if (isAtEnd() || peek() == '\'') {
            error("Empty character literal");
            return;
        }

        char value;
        if (peek() == '\\') {
            advance();
            value = escapeChar();
        } else {
            value = advance();
        }

        if (peek() != '\'') {
            error("Unterminated character literal");
            return;
        }
        advance();

        addToken(TokenType.CHAR_LITERAL, value);
    }

    private void number() {
        // 十六进制 / 二进制
        if (source.charAt(start) == '0' && current < source.length()) {
            char next = Character.toLowerCase(peek());
            if (next == 'x') {
                radixNumber(16);
                return;
            } else if (next == 'b' && (peekNext() == '0' || peekNext() == '1')) {
                radixNumber(2);
                return;
            }
        }

        while (isDigit(peek()) || peek() == '_') advance();

        // 小数部分（'..' 是范围运算符，不是小数点）
        boolean isFloat = false;
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            while (isDigit(peek()) || peek() == '_') advance();
        }

        // 指数部分
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || peekNext() == '+' || peekNext() == '-')) {
            isFloat = true;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            while (isDigit(peek())) advance();
        }

        String text = stripUnderscores(source.substring(start, current));
        try {
            if (isFloat) {
                addToken(TokenType.FLOAT_LITERAL, Double.parseDouble(text));
            } else {
                addToken(TokenType.INT_LITERAL, Long.parseLong(text));
            }
        } catch (NumberFormatException e) {
            error("Invalid number literal: " + source.substring(start, current));
        }
    }

    private void radixNumber(int radix) {
        advance(); // 消费 'x' / 'b'
        while (isHexDigit(peek()) || peek() == '_') advance();

        String text = stripUnderscores(source.substring(start + 2, current));
        try {
            addToken(TokenType.INT_LITERAL, Long.parseLong(text, radix));
        } catch (NumberFormatException e) {
            error("Invalid integer literal: " + source.substring(start, current));
        }
    }

    /** 移除数字中的下划线分隔符 */
    private static String stripUnderscores(String text) {
        return text.indexOf('_') >= 0 ? text.replace("_", "") : text;
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) ||
               (c >= 'a' && c <= 'f') ||
               (c >= 'A' && c <= 'F');
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void blockComment() {
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            if (peek() == '/' && peekNext() == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                depth--;
            } else {
                if (advance() == '\n') newLine();
            }
        }
        if (depth > 0) {
            error("Unterminated block comment");
        }
    }

    private void error(String message) {
        errorCount++;
        String errorMsg = String.format("[%s:%d:%d] Lexer error: %s",
                fileName, line, column, message);
        errStream.println(errorMsg);
        addToken(TokenType.ERROR, message);
    }
}
