package com.crustylang.compiler.parser;

import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.Visibility;
import com.crustylang.compiler.ast.decl.Attribute;
import com.crustylang.compiler.ast.decl.FunctionDecl;
import com.crustylang.compiler.ast.expr.Expression;
import com.crustylang.compiler.ast.expr.StructInitExpr;
import com.crustylang.compiler.ast.stmt.*;
import com.crustylang.compiler.ast.type.TypeRef;
import com.crustylang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.crustylang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        if (parser.check(LBRACE)) {
            return parseBlock();
        }
        // 标签: .outer: while (...) { ... }
        if (parser.check(DOT) && parser.peek(1).getType() == IDENTIFIER
                && parser.peek(2).getType() == COLON) {
            return parseLabeledLoop();
        }
        if (parser.check(KW_IF)) {
            return parseIfStmt();
        }
        if (parser.checkAny(KW_WHILE, KW_LOOP, KW_FOR)) {
            return parseLoop(null);
        }
        if (parser.check(KW_SWITCH)) {
            return parseSwitchStmt();
        }
        if (parser.check(KW_RETURN)) {
            return parseReturnStmt();
        }
        if (parser.check(KW_BREAK)) {
            return parseBreakStmt();
        }
        if (parser.check(KW_CONTINUE)) {
            return parseContinueStmt();
        }
        if (parser.checkAny(KW_LET, KW_VAR, KW_CONST)) {
            LetStmt let = parseKeywordDeclaration();
            parser.expect(SEMICOLON, "Expected ';' after declaration");
            return let;
        }
        if (parser.check(KW_STATIC)) {
            // static 嵌套函数：语法上接受，语义分析报告可见性错误
            SourceLocation loc = parser.location();
            parser.advance();
            TypeRef returnType = parser.parseType();
            String name = parser.expectIdentifier("Expected nested function name");
            FunctionDecl fn = parser.declParser.parseFunctionRest(loc, Collections.<Attribute>emptyList(),
                    Visibility.PRIVATE, returnType, name, true);
            return new NestedFunctionStmt(fn.getLocation(), fn);
        }
        if (parser.canStartType()) {
            Statement stmt = tryParseTypedStatement();
            if (stmt != null) {
                return stmt;
            }
        }

        return parseExpressionStmt();
    }

    Block parseBlock() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        List<Statement> statements = new ArrayList<Statement>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            statements.add(parseStatement());
        }
        parser.expect(RBRACE, "Expected '}'");
        return new Block(parser.spanFrom(loc), statements);
    }

    /**
     * 分支体：有花括号时为代码块，否则单条语句包装为代码块
     */
    private Block parseBody() {
        if (parser.check(LBRACE)) {
            return parseBlock();
        }
        Statement single = parseStatement();
        return new Block(single.getLocation(), Collections.singletonList(single));
    }

    /**
     * 以类型开头的语句：{@code Type name = e;}、{@code Type name;}、嵌套函数 {@code Type name(...) {...}}。
     * 试探失败时回溯并返回 null，由调用方按表达式语句解析。
     */
    private Statement tryParseTypedStatement() {
        SourceLocation loc = parser.location();
        Parser.Mark mark = parser.mark();
        TypeRef type;
        String name;
        boolean nestedFunction = false;
        try {
            type = parser.parseType();
            if (!parser.check(IDENTIFIER)) {
                parser.reset(mark);
                return null;
            }
            name = parser.advance().getLexeme();
            if (parser.check(LPAREN)) {
                nestedFunction = looksLikeFunctionHeader();
                if (!nestedFunction) {
                    parser.reset(mark);
                    return null;
                }
            } else if (!parser.checkAny(ASSIGN, SEMICOLON)) {
                parser.reset(mark);
                return null;
            }
        } catch (ParseException e) {
            parser.reset(mark);
            return null;
        }

        if (nestedFunction) {
            FunctionDecl fn = parser.declParser.parseFunctionRest(loc, Collections.<Attribute>emptyList(),
                    Visibility.PUBLIC, type, name, true);
            return new NestedFunctionStmt(fn.getLocation(), fn);
        }

        LetStmt let = finishDeclaration(loc, name, type, LetStmt.Kind.LET);
        parser.expect(SEMICOLON, "Expected ';' after declaration");
        return let;
    }

    /**
     * 当前在 '(' 上：参数列表之后是否紧跟 '{'。游标恢复原位。
     */
    private boolean looksLikeFunctionHeader() {
        Parser.Mark mark = parser.mark();
        try {
            parser.declParser.parseParameters();
            return parser.check(LBRACE);
        } catch (ParseException e) {
            return false;
        } finally {
            parser.reset(mark);
        }
    }

    /**
     * let / var / const 开头的声明（不消费结尾的 ';'）
     */
    LetStmt parseKeywordDeclaration() {
        SourceLocation loc = parser.location();
        LetStmt.Kind kind;
        if (parser.match(KW_VAR)) {
            kind = LetStmt.Kind.VAR;
        } else if (parser.match(KW_CONST)) {
            kind = LetStmt.Kind.CONST;
        } else {
            parser.expect(KW_LET, "Expected 'let'");
            kind = LetStmt.Kind.LET;
        }

        TypeRef type = null;
        String name;
        TokenType afterName = parser.peek(1).getType();
        if (parser.check(IDENTIFIER) && (afterName == ASSIGN || afterName == COLON || afterName == SEMICOLON)) {
            // let name = e; / let name: Type = e;
            name = parser.advance().getLexeme();
            if (parser.match(COLON)) {
                type = parser.parseType();
            }
        } else {
            // let Type name = e;
            type = parser.parseType();
            name = parser.expectIdentifier("Expected variable name");
        }

        LetStmt let = finishDeclaration(loc, name, type, kind);
        if (kind == LetStmt.Kind.CONST && !let.hasInitializer()) {
            throw new ParseException("Constant '" + name + "' requires a value", parser.current, "ASSIGN");
        }
        return let;
    }

    private LetStmt finishDeclaration(SourceLocation loc, String name, TypeRef type, LetStmt.Kind kind) {
        Expression init = null;
        if (parser.match(ASSIGN)) {
            init = parser.parseExpression();
            // { .x = 1 } 取声明类型
            if (init instanceof StructInitExpr && !((StructInitExpr) init).hasType() && type != null) {
                init = ((StructInitExpr) init).withType(type);
            }
        }
        return new LetStmt(parser.spanFrom(loc), name, type, init, kind);
    }

    private Statement parseExpressionStmt() {
        SourceLocation loc = parser.location();
        Expression expr = parser.parseExpression();
        parser.expect(SEMICOLON, "Expected ';' after expression");
        return new ExpressionStmt(parser.spanFrom(loc), expr);
    }

    // ============ 控制流 ============

    private Statement parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IF, "Expected 'if'");
        parser.expect(LPAREN, "Expected '(' after 'if'");
        Expression condition = parser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after condition");
        Block thenBranch = parseBody();

        Statement elseBranch = null;
        if (parser.match(KW_ELSE)) {
            if (parser.check(KW_IF)) {
                elseBranch = parseIfStmt();
            } else {
                elseBranch = parseBody();
            }
        }
        return new IfStmt(parser.spanFrom(loc), condition, thenBranch, elseBranch);
    }

    private Statement parseLabeledLoop() {
        parser.expect(DOT, "Expected '.'");
        String label = parser.expectIdentifier("Expected label name");
        parser.expect(COLON, "Expected ':' after label");
        if (!parser.checkAny(KW_WHILE, KW_LOOP, KW_FOR)) {
            throw new ParseException("Label must precede a loop", parser.current, "loop");
        }
        return parseLoop(label);
    }

    private Statement parseLoop(String label) {
        if (parser.check(KW_WHILE)) {
            return parseWhileStmt(label);
        }
        if (parser.check(KW_LOOP)) {
            SourceLocation loc = parser.location();
            parser.advance();
            Block body = parseBlock();
            return new LoopStmt(parser.spanFrom(loc), label, body);
        }
        return parseForStmt(label);
    }

    private Statement parseWhileStmt(String label) {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHILE, "Expected 'while'");
        parser.expect(LPAREN, "Expected '(' after 'while'");
        Expression condition = parser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after condition");
        Block body = parseBody();
        return new WhileStmt(parser.spanFrom(loc), label, condition, body);
    }

    private Statement parseForStmt(String label) {
        SourceLocation loc = parser.location();
        parser.expect(KW_FOR, "Expected 'for'");
        parser.expect(LPAREN, "Expected '(' after 'for'");

        // for (x in iterable)
        if (parser.check(IDENTIFIER) && parser.checkAhead(KW_IN)) {
            String variable = parser.advance().getLexeme();
            parser.advance(); // consume 'in'
            Expression iterable = parser.exprParser.parseRangeOrExpression();
            parser.expect(RPAREN, "Expected ')' after for-in iterable");
            Block body = parseBody();
            return new ForInStmt(parser.spanFrom(loc), label, variable, iterable, body);
        }

        // for (init; cond; update)
        Statement initializer = null;
        if (!parser.match(SEMICOLON)) {
            initializer = parseForInitializer();
        }
        Expression condition = null;
        if (!parser.check(SEMICOLON)) {
            condition = parser.parseExpression();
        }
        parser.expect(SEMICOLON, "Expected ';' after for condition");
        Expression update = null;
        if (!parser.check(RPAREN)) {
            update = parser.parseExpression();
        }
        parser.expect(RPAREN, "Expected ')' after for clauses");
        Block body = parseBody();
        return new ForStmt(parser.spanFrom(loc), label, initializer, condition, update, body);
    }

    /**
     * for 初始化子句（消费 ';'）：声明或表达式
     */
    private Statement parseForInitializer() {
        if (parser.checkAny(KW_LET, KW_VAR, KW_CONST)) {
            LetStmt let = parseKeywordDeclaration();
            parser.expect(SEMICOLON, "Expected ';' after for initializer");
            return let;
        }
        if (parser.canStartType()) {
            Statement stmt = tryParseTypedStatement();
            if (stmt instanceof LetStmt) {
                return stmt;
            }
            if (stmt != null) {
                throw new ParseException("Expected declaration or expression in for initializer", parser.current);
            }
        }
        return parseExpressionStmt();
    }

    private Statement parseSwitchStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_SWITCH, "Expected 'switch'");
        parser.expect(LPAREN, "Expected '(' after 'switch'");
        Expression subject = parser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after switch subject");
        parser.expect(LBRACE, "Expected '{' after switch");

        List<SwitchCase> cases = new ArrayList<SwitchCase>();
        Block defaultBranch = null;
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation caseLoc = parser.location();
            if (parser.match(KW_CASE)) {
                List<Expression> values = new ArrayList<Expression>();
                do {
                    values.add(parser.parseNonCommaExpression());
                } while (parser.match(COMMA));
                parser.expect(COLON, "Expected ':' after case values");
                Block body = parseCaseBody(caseLoc);
                cases.add(new SwitchCase(parser.spanFrom(caseLoc), values, body));
            } else if (parser.match(KW_DEFAULT)) {
                if (defaultBranch != null) {
                    throw new ParseException("Duplicate default branch", parser.previous);
                }
                parser.expect(COLON, "Expected ':' after 'default'");
                defaultBranch = parseCaseBody(caseLoc);
            } else {
                throw new ParseException("Expected 'case' or 'default'", parser.current, "case");
            }
        }
        parser.expect(RBRACE, "Expected '}' after switch body");
        return new SwitchStmt(parser.spanFrom(loc), subject, cases, defaultBranch);
    }

    /**
     * case 体：到下一个 case/default/'}' 为止。末尾无标签的 break 去掉；
     * 单独一个代码块时直接使用该代码块。
     */
    private Block parseCaseBody(SourceLocation loc) {
        List<Statement> statements = new ArrayList<Statement>();
        while (!parser.checkAny(KW_CASE, KW_DEFAULT, RBRACE) && !parser.isAtEnd()) {
            statements.add(parseStatement());
        }
        if (!statements.isEmpty()) {
            Statement last = statements.get(statements.size() - 1);
            if (last instanceof BreakStmt && !((BreakStmt) last).hasLabel()) {
                statements.remove(statements.size() - 1);
            }
        }
        if (statements.size() == 1 && statements.get(0) instanceof Block) {
            return (Block) statements.get(0);
        }
        return new Block(parser.spanFrom(loc), statements);
    }

    private Statement parseReturnStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_RETURN, "Expected 'return'");
        Expression value = null;
        if (!parser.check(SEMICOLON)) {
            value = parser.parseExpression();
        }
        parser.expect(SEMICOLON, "Expected ';' after return");
        return new ReturnStmt(parser.spanFrom(loc), value);
    }

    private Statement parseBreakStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_BREAK, "Expected 'break'");
        String label = parseJumpLabel();
        parser.expect(SEMICOLON, "Expected ';' after break");
        return new BreakStmt(parser.spanFrom(loc), label);
    }

    private Statement parseContinueStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_CONTINUE, "Expected 'continue'");
        String label = parseJumpLabel();
        parser.expect(SEMICOLON, "Expected ';' after continue");
        return new ContinueStmt(parser.spanFrom(loc), label);
    }

    // break .outer;
    private String parseJumpLabel() {
        if (parser.match(DOT)) {
            return parser.expectIdentifier("Expected label name after '.'");
        }
        return null;
    }
}
