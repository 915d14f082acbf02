package com.crustylang.compiler.parser;

import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.decl.CompilationUnit;
import com.crustylang.compiler.ast.decl.Item;
import com.crustylang.compiler.ast.expr.Expression;
import com.crustylang.compiler.ast.stmt.Block;
import com.crustylang.compiler.ast.stmt.Statement;
import com.crustylang.compiler.ast.type.TypeRef;
import com.crustylang.compiler.lexer.Lexer;
import com.crustylang.compiler.lexer.Token;
import com.crustylang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.crustylang.compiler.lexer.TokenType.*;

/**
 * Crusty 语法分析器（递归下降）。
 *
 * <p>Token 在构造时一次性读入，游标是列表下标，{@link #mark()}/{@link #reset(Mark)}
 * 只需保存下标和少量状态，可以任意嵌套。类型实参结束处的 {@code >>} 按需拆成两个 {@code >}，
 * 拆分状态也属于游标快照，回溯时一并恢复。</p>
 */
public class Parser {

    final String fileName;
    private final List<Token> tokens;
    private int position;
    Token current;
    Token previous;
    private Token pendingGt;  // '>>' 拆分后剩下的半个 '>'

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer, String fileName) {
        this(lexer.scanTokens(), fileName);
    }

    public Parser(List<Token> tokens, String fileName) {
        this.tokens = new ArrayList<Token>(tokens);
        if (this.tokens.isEmpty() || this.tokens.get(this.tokens.size() - 1).getType() != EOF) {
            this.tokens.add(new Token(EOF, "", null, 0, 0, 0));
        }
        this.fileName = fileName;
        this.position = 0;
        this.current = this.tokens.get(0);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    Token advance() {
        previous = current;
        if (pendingGt != null) {
            current = pendingGt;
            pendingGt = null;
        } else if (position < tokens.size() - 1) {
            position++;
            current = tokens.get(position);
        }
        checkLexicalError();
        return previous;
    }

    /**
     * 词法错误 Token 一旦成为当前 token 即终止解析
     */
    private void checkLexicalError() {
        if (current.getType() == ERROR) {
            Object detail = current.getLiteral();
            throw new ParseException("Lexical error: " + (detail != null ? detail : "invalid token"), current);
        }
    }

    /**
     * 向前看 n 个 token（n = 0 为当前 token）
     */
    Token peek(int n) {
        if (n == 0) return current;
        if (pendingGt != null && n == 1) return pendingGt;
        int offset = pendingGt != null ? n - 1 : n;
        int index = Math.min(position + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    Token peek() {
        return peek(1);
    }

    /**
     * 游标快照
     */
    static final class Mark {
        final int position;
        final Token current;
        final Token previous;
        final Token pendingGt;

        Mark(int position, Token current, Token previous, Token pendingGt) {
            this.position = position;
            this.current = current;
            this.previous = previous;
            this.pendingGt = pendingGt;
        }
    }

    /**
     * 标记当前位置，用于回溯
     */
    Mark mark() {
        return new Mark(position, current, previous, pendingGt);
    }

    /**
     * 回溯到标记的位置
     */
    void reset(Mark mark) {
        this.position = mark.position;
        this.current = mark.current;
        this.previous = mark.previous;
        this.pendingGt = mark.pendingGt;
    }

    /**
     * 把当前的 '>>' 拆为两个 '>'，当前 token 变为第一个 '>'
     */
    void splitShiftRight() {
        Token shr = current;
        current = new Token(GT, ">", null, shr.getLine(), shr.getColumn(), shr.getOffset());
        pendingGt = new Token(GT, ">", null, shr.getLine(), shr.getColumn() + 1, shr.getOffset() + 1);
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 向前看一个 token（不消费当前）
     */
    boolean checkAhead(TokenType type) {
        return peek().getType() == type;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配任一类型，则前进
     */
    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    /**
     * 期望标识符并返回其文本
     */
    String expectIdentifier(String message) {
        return expect(IDENTIFIER, message).getLexeme();
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return new SourceLocation(fileName, current.getLine(), current.getColumn(),
                current.getOffset(), current.getLexeme().length());
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        if (previous == null) {
            return location();
        }
        return new SourceLocation(fileName, previous.getLine(), previous.getColumn(),
                previous.getOffset(), previous.getLexeme().length());
    }

    /**
     * 从 start 到刚消费的 token 的 span
     */
    SourceLocation spanFrom(SourceLocation start) {
        return start.to(previousLocation());
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 编译单元解析 ============

    /**
     * 解析整个编译单元
     *
     * @throws ParseException 第一个语法错误
     */
    public CompilationUnit parse() {
        checkLexicalError();
        SourceLocation loc = location();
        List<Item> items = new ArrayList<Item>();
        while (!isAtEnd()) {
            items.add(declParser.parseItem());
        }
        return new CompilationUnit(spanFrom(loc), fileName, items);
    }

    /**
     * 解析单个表达式（要求消费全部输入）
     */
    public Expression parseStandaloneExpression() {
        checkLexicalError();
        Expression expr = parseExpression();
        if (!isAtEnd()) {
            throw new ParseException("Unexpected trailing input", current, "EOF");
        }
        return expr;
    }

    /**
     * 解析单个语句（要求消费全部输入）
     */
    public Statement parseStandaloneStatement() {
        checkLexicalError();
        Statement stmt = parseStatement();
        if (!isAtEnd()) {
            throw new ParseException("Unexpected trailing input", current, "EOF");
        }
        return stmt;
    }

    // ============ 类型解析委托 ============

    TypeRef parseType() { return typeParser.parseType(); }
    boolean canStartType() { return typeParser.canStartType(); }

    // ============ 语句解析委托 ============

    Statement parseStatement() { return stmtParser.parseStatement(); }
    Block parseBlock() { return stmtParser.parseBlock(); }

    // ============ 表达式解析委托 ============

    Expression parseExpression() { return exprParser.parseExpression(); }
    Expression parseNonCommaExpression() { return exprParser.parseAssignmentExpr(); }
    List<Expression> parseArguments(TokenType close) { return exprParser.parseArguments(close); }
}
