package com.crustylang.compiler.parser;

import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.expr.*;
import com.crustylang.compiler.ast.type.NamedType;
import com.crustylang.compiler.ast.type.TypeRef;
import com.crustylang.compiler.formatter.CrustyStringUtils;
import com.crustylang.compiler.lexer.Token;
import com.crustylang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.crustylang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类。每个优先级一个方法，从低到高：
 * 逗号、赋值、三元、||、&amp;&amp;、|、^、&amp;、相等、比较、移位、加减、乘除、一元前缀、后缀、基本表达式。
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    // 逗号表达式（最低优先级，左结合，值为最后一项）
    Expression parseExpression() {
        SourceLocation loc = parser.location();
        Expression first = parseAssignmentExpr();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> parts = new ArrayList<Expression>();
        parts.add(first);
        while (parser.match(COMMA)) {
            parts.add(parseAssignmentExpr());
        }
        return new CommaExpr(parser.spanFrom(loc), parts);
    }

    // 赋值表达式（右结合）
    Expression parseAssignmentExpr() {
        Expression left = parseTernaryExpr();

        if (parser.current.getType().isAssignmentOp()) {
            Token op = parser.advance();
            Expression right = parseAssignmentExpr();  // 右结合

            AssignExpr.AssignOp assignOp;
            switch (op.getType()) {
                case ASSIGN: assignOp = AssignExpr.AssignOp.ASSIGN; break;
                case PLUS_ASSIGN: assignOp = AssignExpr.AssignOp.ADD_ASSIGN; break;
                case MINUS_ASSIGN: assignOp = AssignExpr.AssignOp.SUB_ASSIGN; break;
                case MUL_ASSIGN: assignOp = AssignExpr.AssignOp.MUL_ASSIGN; break;
                case DIV_ASSIGN: assignOp = AssignExpr.AssignOp.DIV_ASSIGN; break;
                case MOD_ASSIGN: assignOp = AssignExpr.AssignOp.MOD_ASSIGN; break;
                case AND_ASSIGN: assignOp = AssignExpr.AssignOp.AND_ASSIGN; break;
                case OR_ASSIGN: assignOp = AssignExpr.AssignOp.OR_ASSIGN; break;
                case XOR_ASSIGN: assignOp = AssignExpr.AssignOp.XOR_ASSIGN; break;
                case SHL_ASSIGN: assignOp = AssignExpr.AssignOp.SHL_ASSIGN; break;
                case SHR_ASSIGN: assignOp = AssignExpr.AssignOp.SHR_ASSIGN; break;
                default: throw new ParseException("Unexpected assignment operator", op);
            }
            return new AssignExpr(left.getLocation().to(right.getLocation()), left, assignOp, right);
        }

        return left;
    }

    // 三元表达式 condition ? thenExpr : elseExpr（右结合）
    private Expression parseTernaryExpr() {
        Expression condition = parseLogicalOr();

        if (parser.match(QUESTION)) {
            Expression thenExpr = parseAssignmentExpr();
            parser.expect(COLON, "Expected ':' in ternary expression");
            Expression elseExpr = parseTernaryExpr();  // 右结合
            return new ConditionalExpr(condition.getLocation().to(elseExpr.getLocation()),
                    condition, thenExpr, elseExpr);
        }

        return condition;
    }

    // 逻辑或 ||
    private Expression parseLogicalOr() {
        Expression left = parseLogicalAnd();
        while (parser.match(OR)) {
            Expression right = parseLogicalAnd();
            left = binary(left, BinaryExpr.BinaryOp.OR, right);
        }
        return left;
    }

    // 逻辑与 &&
    private Expression parseLogicalAnd() {
        Expression left = parseBitOr();
        while (parser.match(AND)) {
            Expression right = parseBitOr();
            left = binary(left, BinaryExpr.BinaryOp.AND, right);
        }
        return left;
    }

    // 按位或 |
    private Expression parseBitOr() {
        Expression left = parseBitXor();
        while (parser.match(PIPE)) {
            Expression right = parseBitXor();
            left = binary(left, BinaryExpr.BinaryOp.BIT_OR, right);
        }
        return left;
    }

    // 按位异或 ^
    private Expression parseBitXor() {
        Expression left = parseBitAnd();
        while (parser.match(CARET)) {
            Expression right = parseBitAnd();
            left = binary(left, BinaryExpr.BinaryOp.BIT_XOR, right);
        }
        return left;
    }

    // 按位与 &
    private Expression parseBitAnd() {
        Expression left = parseEquality();
        while (parser.match(AMP)) {
            Expression right = parseEquality();
            left = binary(left, BinaryExpr.BinaryOp.BIT_AND, right);
        }
        return left;
    }

    // 相等性 == !=
    private Expression parseEquality() {
        Expression left = parseComparison();
        while (parser.checkAny(EQ, NE)) {
            Token op = parser.advance();
            Expression right = parseComparison();
            left = binary(left, op.getType() == EQ ? BinaryExpr.BinaryOp.EQ : BinaryExpr.BinaryOp.NE, right);
        }
        return left;
    }

    // 比较 < > <= >=
    private Expression parseComparison() {
        Expression left = parseShift();
        while (parser.checkAny(LT, GT, LE, GE)) {
            Token op = parser.advance();
            Expression right = parseShift();
            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case LT: binOp = BinaryExpr.BinaryOp.LT; break;
                case GT: binOp = BinaryExpr.BinaryOp.GT; break;
                case LE: binOp = BinaryExpr.BinaryOp.LE; break;
                case GE: binOp = BinaryExpr.BinaryOp.GE; break;
                default: throw new ParseException("Unexpected operator", op);
            }
            left = binary(left, binOp, right);
        }
        return left;
    }

    // 移位 << >>
    private Expression parseShift() {
        Expression left = parseAdditive();
        while (parser.checkAny(SHL, SHR)) {
            Token op = parser.advance();
            Expression right = parseAdditive();
            left = binary(left, op.getType() == SHL ? BinaryExpr.BinaryOp.SHL : BinaryExpr.BinaryOp.SHR, right);
        }
        return left;
    }

    // 加减 + -
    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            Expression right = parseMultiplicative();
            left = binary(left, op.getType() == PLUS ? BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB, right);
        }
        return left;
    }

    // 乘除 * / %
    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (parser.checkAny(STAR, SLASH, PERCENT)) {
            Token op = parser.advance();
            Expression right = parseUnary();
            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case STAR: binOp = BinaryExpr.BinaryOp.MUL; break;
                case SLASH: binOp = BinaryExpr.BinaryOp.DIV; break;
                default: binOp = BinaryExpr.BinaryOp.MOD; break;
            }
            left = binary(left, binOp, right);
        }
        return left;
    }

    private static Expression binary(Expression left, BinaryExpr.BinaryOp op, Expression right) {
        return new BinaryExpr(left.getLocation().to(right.getLocation()), left, op, right);
    }

    // 一元前缀 ! - ~ & &var * ++ --，以及 C 风格类型转换
    Expression parseUnary() {
        SourceLocation loc = parser.location();

        if (parser.match(NOT)) {
            return unary(loc, UnaryExpr.UnaryOp.NOT);
        }
        if (parser.match(MINUS)) {
            return unary(loc, UnaryExpr.UnaryOp.NEG);
        }
        if (parser.match(TILDE)) {
            return unary(loc, UnaryExpr.UnaryOp.BIT_NOT);
        }
        if (parser.match(STAR)) {
            return unary(loc, UnaryExpr.UnaryOp.DEREF);
        }
        if (parser.match(INC)) {
            return unary(loc, UnaryExpr.UnaryOp.PRE_INC);
        }
        if (parser.match(DEC)) {
            return unary(loc, UnaryExpr.UnaryOp.PRE_DEC);
        }
        if (parser.match(AMP)) {
            if (parser.match(KW_VAR)) {
                return unary(loc, UnaryExpr.UnaryOp.REF_MUT);
            }
            return unary(loc, UnaryExpr.UnaryOp.REF);
        }
        if (parser.match(AND)) {
            // &&x 是对引用再取引用
            Expression inner = parseUnary();
            SourceLocation span = parser.spanFrom(loc);
            return new UnaryExpr(span, UnaryExpr.UnaryOp.REF, new UnaryExpr(span, UnaryExpr.UnaryOp.REF, inner));
        }
        if (parser.check(LPAREN)) {
            Expression cast = tryParseCast();
            if (cast != null) {
                return cast;
            }
        }

        return parsePostfix();
    }

    private Expression unary(SourceLocation loc, UnaryExpr.UnaryOp op) {
        Expression operand = parseUnary();
        return new UnaryExpr(parser.spanFrom(loc), op, operand);
    }

    /**
     * 尝试解析 {@code (Type) operand}。失败时游标恢复原位并返回 null。
     */
    private Expression tryParseCast() {
        SourceLocation loc = parser.location();
        Parser.Mark mark = parser.mark();
        TypeRef type;
        try {
            parser.advance(); // consume '('
            type = parser.parseType();
            if (!parser.check(RPAREN)) {
                parser.reset(mark);
                return null;
            }
            parser.advance(); // consume ')'
        } catch (ParseException e) {
            parser.reset(mark);
            return null;
        }

        // 单个名字也可能是变量：(x) - y 仍是减法
        boolean bareName = type instanceof NamedType;
        if (!canStartCastOperand(bareName)) {
            parser.reset(mark);
            return null;
        }

        Expression operand = parseUnary();
        return new CastExpr(parser.spanFrom(loc), type, operand);
    }

    private boolean canStartCastOperand(boolean bareName) {
        switch (parser.current.getType()) {
            case INT_LITERAL:
            case FLOAT_LITERAL:
            case CHAR_LITERAL:
            case STRING_LITERAL:
            case KW_TRUE:
            case KW_FALSE:
            case KW_NULL:
            case KW_SELF:
            case KW_SIZEOF:
            case IDENTIFIER:
            case LPAREN:
            case NOT:
            case TILDE:
            case AT:
                return true;
            case MINUS:
            case STAR:
            case AMP:
            case AND:
            case INC:
            case DEC:
            case LBRACKET:
                return !bareName;
            default:
                return false;
        }
    }

    // 后缀：调用、索引、字段、->、方法调用、错误传播 ?
    private Expression parsePostfix() {
        Expression expr = parsePrimary();

        while (true) {
            SourceLocation loc = expr.getLocation();
            if (parser.check(LPAREN)) {
                parser.advance();
                List<Expression> args = parseArguments(RPAREN);
                expr = new CallExpr(parser.spanFrom(loc), expr, args);
            } else if (parser.match(LBRACKET)) {
                Expression index = parseRangeOrExpression();
                parser.expect(RBRACKET, "Expected ']' after index");
                expr = new IndexExpr(parser.spanFrom(loc), expr, index);
            } else if (parser.match(DOT)) {
                expr = parseMember(loc, expr);
            } else if (parser.match(ARROW)) {
                // p->f 即 (*p).f
                Expression deref = new UnaryExpr(parser.spanFrom(loc), UnaryExpr.UnaryOp.DEREF, expr);
                expr = parseNamedMember(loc, deref);
            } else if (parser.check(QUESTION)) {
                if (isTernaryQuestion()) {
                    break; // 由 parseTernaryExpr 处理
                }
                parser.advance(); // consume ?
                expr = new ErrorPropagationExpr(parser.spanFrom(loc), expr);
            } else if (parser.checkAny(INC, DEC)) {
                throw new ParseException("Postfix '" + parser.current.getLexeme()
                        + "' is not supported, use the prefix form", parser.current);
            } else {
                break;
            }
        }

        return expr;
    }

    // .member / .0 / .method(args)
    private Expression parseMember(SourceLocation loc, Expression target) {
        if (parser.check(INT_LITERAL)) {
            String index = parser.advance().getLexeme();
            return new FieldAccessExpr(parser.spanFrom(loc), target, index);
        }
        if (parser.check(FLOAT_LITERAL)) {
            // t.0.1 被词法分析为 t . 0.1
            String text = parser.advance().getLexeme();
            int dot = text.indexOf('.');
            if (dot <= 0 || dot == text.length() - 1 || !isDigits(text.substring(0, dot))
                    || !isDigits(text.substring(dot + 1))) {
                throw new ParseException("Invalid tuple index", parser.previous);
            }
            Expression first = new FieldAccessExpr(parser.spanFrom(loc), target, text.substring(0, dot));
            return new FieldAccessExpr(parser.spanFrom(loc), first, text.substring(dot + 1));
        }
        return parseNamedMember(loc, target);
    }

    private Expression parseNamedMember(SourceLocation loc, Expression target) {
        String name = parser.expectIdentifier("Expected member name");
        if (parser.match(LPAREN)) {
            List<Expression> args = parseArguments(RPAREN);
            return new MethodCallExpr(parser.spanFrom(loc), target, name, args);
        }
        return new FieldAccessExpr(parser.spanFrom(loc), target, name);
    }

    private static boolean isDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return !s.isEmpty();
    }

    /**
     * 区分三元 ? 与错误传播 ?：在括号深度 0 处、语句结束前能找到 ':' 则为三元
     */
    private boolean isTernaryQuestion() {
        Parser.Mark mark = parser.mark();
        try {
            parser.advance(); // consume ?

            // ? 后紧跟终止符/关闭括号/逗号/冒号 → 错误传播
            if (parser.isAtEnd() || parser.checkAny(SEMICOLON, RPAREN, RBRACKET, RBRACE, COMMA, COLON, QUESTION)) {
                return false;
            }

            int depth = 0;
            while (!parser.isAtEnd()) {
                if (parser.check(COLON) && depth == 0) {
                    return true;
                }
                if (parser.checkAny(LPAREN, LBRACKET, LBRACE)) {
                    depth++;
                } else if (parser.checkAny(RPAREN, RBRACKET, RBRACE)) {
                    if (depth == 0) break; // 不匹配的关闭括号
                    depth--;
                } else if (depth == 0 && parser.check(SEMICOLON)) {
                    break; // 语句边界
                }
                parser.advance();
            }
            return false;
        } catch (ParseException e) {
            return false;
        } finally {
            parser.reset(mark);
        }
    }

    // 基本表达式
    private Expression parsePrimary() {
        SourceLocation loc = parser.location();
        Token token = parser.current;

        switch (token.getType()) {
            case INT_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.INT, token.getLexeme());
            case FLOAT_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.FLOAT, token.getLexeme());
            case STRING_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.STRING, token.getLexeme());
            case CHAR_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.CHAR, token.getLexeme());
            case KW_TRUE:
                parser.advance();
                return new Literal(loc, Boolean.TRUE, Literal.LiteralKind.BOOLEAN, "true");
            case KW_FALSE:
                parser.advance();
                return new Literal(loc, Boolean.FALSE, Literal.LiteralKind.BOOLEAN, "false");
            case KW_NULL:
                parser.advance();
                return new Literal(loc, null, Literal.LiteralKind.NULL, "NULL");
            case KW_SELF:
                parser.advance();
                return new Identifier(loc, "self");
            case IDENTIFIER:
                return parseIdentifierExpr();
            case LPAREN:
                return parseParenOrTuple();
            case LBRACKET:
                return parseArrayLiteral();
            case LBRACE:
                if (parser.checkAhead(DOT)) {
                    return parseStructInit(loc, null);
                }
                break;
            case KW_SIZEOF:
                return parseSizeof();
            case AT:
                return parseTypeScopedCall();
            case RANGE:
            case RANGE_INCLUSIVE:
                throw new ParseException("Range expressions are only allowed in index and for-in positions", token);
            default:
                break;
        }

        throw new ParseException("Expected expression", token, "expression");
    }

    // 标识符、宏调用或 Type { .f = e } 结构体初始化
    private Expression parseIdentifierExpr() {
        SourceLocation loc = parser.location();
        String name = parser.advance().getLexeme();

        if (CrustyStringUtils.isMacroName(name)) {
            return parseMacroCall(loc, name);
        }

        if (parser.check(LBRACE) && parser.checkAhead(DOT)) {
            return parseStructInit(loc, new NamedType(loc, name));
        }

        return new Identifier(loc, name);
    }

    // __name__(...) / __name__[...] / __name__{...}，没有参数列表时视为无参调用
    private Expression parseMacroCall(SourceLocation loc, String name) {
        MacroCallExpr.Delimiter delimiter;
        TokenType close;
        if (parser.match(LPAREN)) {
            delimiter = MacroCallExpr.Delimiter.PAREN;
            close = RPAREN;
        } else if (parser.match(LBRACKET)) {
            delimiter = MacroCallExpr.Delimiter.BRACKET;
            close = RBRACKET;
        } else if (parser.match(LBRACE)) {
            delimiter = MacroCallExpr.Delimiter.BRACE;
            close = RBRACE;
        } else {
            return new MacroCallExpr(loc, name, MacroCallExpr.Delimiter.PAREN,
                    Collections.<Expression>emptyList());
        }
        List<Expression> args = parseArguments(close);
        return new MacroCallExpr(parser.spanFrom(loc), name, delimiter, args);
    }

    /**
     * 逗号分隔的参数，消费结束符；允许尾随逗号
     */
    List<Expression> parseArguments(TokenType close) {
        List<Expression> args = new ArrayList<Expression>();
        if (parser.match(close)) {
            return args;
        }
        do {
            if (parser.check(close)) break;  // 尾随逗号
            args.add(parseAssignmentExpr());
        } while (parser.match(COMMA));
        parser.expect(close, "Expected '" + closeText(close) + "' after arguments");
        return args;
    }

    private static String closeText(TokenType close) {
        switch (close) {
            case RPAREN: return ")";
            case RBRACKET: return "]";
            case RBRACE: return "}";
            default: return close.name();
        }
    }

    // (e) / (a, b) / ()
    private Expression parseParenOrTuple() {
        SourceLocation loc = parser.location();
        parser.expect(LPAREN, "Expected '('");

        if (parser.match(RPAREN)) {
            return new TupleLiteralExpr(parser.spanFrom(loc), Collections.<Expression>emptyList());
        }

        Expression first = parseAssignmentExpr();
        if (parser.match(RPAREN)) {
            return new ParenExpr(parser.spanFrom(loc), first);
        }

        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RPAREN)) break;  // 尾随逗号
            elements.add(parseAssignmentExpr());
        }
        parser.expect(RPAREN, "Expected ')' after tuple elements");
        return new TupleLiteralExpr(parser.spanFrom(loc), elements);
    }

    // [a, b] / [v; n]
    private Expression parseArrayLiteral() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACKET, "Expected '['");

        if (parser.match(RBRACKET)) {
            return new ArrayLiteralExpr(parser.spanFrom(loc), Collections.<Expression>emptyList());
        }

        Expression first = parseAssignmentExpr();
        if (parser.match(SEMICOLON)) {
            Expression count = parseAssignmentExpr();
            parser.expect(RBRACKET, "Expected ']' after repeat count");
            return new ArrayRepeatExpr(parser.spanFrom(loc), first, count);
        }

        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACKET)) break;
            elements.add(parseAssignmentExpr());
        }
        parser.expect(RBRACKET, "Expected ']' after array elements");
        return new ArrayLiteralExpr(parser.spanFrom(loc), elements);
    }

    // { .x = 1, .y = 2 }
    Expression parseStructInit(SourceLocation loc, TypeRef type) {
        parser.expect(LBRACE, "Expected '{'");
        List<StructInitExpr.FieldInit> fields = new ArrayList<StructInitExpr.FieldInit>();
        while (!parser.check(RBRACE)) {
            parser.expect(DOT, "Expected '.' before field name");
            String name = parser.expectIdentifier("Expected field name");
            parser.expect(ASSIGN, "Expected '=' after field name");
            Expression value = parseAssignmentExpr();
            fields.add(new StructInitExpr.FieldInit(name, value));
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RBRACE, "Expected '}' after struct initializer");
        return new StructInitExpr(parser.spanFrom(loc), type, fields);
    }

    // sizeof(Type)
    private Expression parseSizeof() {
        SourceLocation loc = parser.location();
        parser.expect(KW_SIZEOF, "Expected 'sizeof'");
        parser.expect(LPAREN, "Expected '(' after sizeof");
        TypeRef type = parser.parseType();
        parser.expect(RPAREN, "Expected ')' after sizeof type");
        return new SizeofExpr(parser.spanFrom(loc), type);
    }

    // @Type.method(args) / @Type(T).method(args)，无参时括号可省略
    private Expression parseTypeScopedCall() {
        SourceLocation loc = parser.location();
        parser.expect(AT, "Expected '@'");
        TypeRef type = parser.typeParser.parseBaseType();

        List<TypeRef> typeArgs = Collections.emptyList();
        if (parser.check(LPAREN)) {
            typeArgs = parser.typeParser.parseParenthesizedTypeList();
        }

        parser.expect(DOT, "Expected '.' after type in type-scoped call");
        String method = parser.expectIdentifier("Expected method name");

        List<Expression> args = Collections.emptyList();
        if (parser.match(LPAREN)) {
            args = parseArguments(RPAREN);
        }
        return new TypeScopedCallExpr(parser.spanFrom(loc), type, typeArgs, method, args);
    }

    /**
     * 索引与 for-in 位置的范围：a..b、a..=b、..b、a..
     */
    Expression parseRangeOrExpression() {
        SourceLocation loc = parser.location();
        Expression start = null;
        if (!parser.checkAny(RANGE, RANGE_INCLUSIVE)) {
            start = parseAssignmentExpr();
            if (!parser.checkAny(RANGE, RANGE_INCLUSIVE)) {
                return start;
            }
        }
        boolean inclusive = parser.advance().getType() == RANGE_INCLUSIVE;
        Expression end = null;
        if (!parser.checkAny(RBRACKET, RPAREN)) {
            end = parseAssignmentExpr();
        } else if (inclusive) {
            throw new ParseException("Inclusive range requires an end", parser.current, "expression");
        }
        return new RangeExpr(parser.spanFrom(loc), start, end, inclusive);
    }
}
