package com.crustylang.compiler.parser;

import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.Visibility;
import com.crustylang.compiler.ast.decl.*;
import com.crustylang.compiler.ast.expr.Expression;
import com.crustylang.compiler.ast.expr.StructInitExpr;
import com.crustylang.compiler.ast.stmt.Block;
import com.crustylang.compiler.ast.type.TypeRef;
import com.crustylang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.crustylang.compiler.lexer.TokenType.*;

/**
 * 顶层声明解析辅助类
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析一个顶层条目
     */
    Item parseItem() {
        SourceLocation loc = parser.location();

        if (parser.check(HASH) && isDefineDirective()) {
            return parseMacroDefinition();
        }

        List<Attribute> attributes = parseAttributes();

        Visibility visibility = Visibility.PUBLIC;
        if (parser.match(KW_STATIC)) {
            visibility = Visibility.PRIVATE;
        }

        if (parser.check(KW_STRUCT)) {
            return parseStruct(loc, attributes, visibility);
        }
        if (parser.check(KW_ENUM)) {
            return parseEnum(loc, attributes, visibility);
        }
        if (parser.check(KW_TYPEDEF)) {
            return parseTypedef(loc, attributes, visibility);
        }
        if (parser.check(KW_EXTERN)) {
            return parseExternBlock(loc, attributes);
        }
        if (parser.check(KW_CONST)) {
            return parseConst(loc, attributes, visibility);
        }
        if (parser.canStartType()) {
            TypeRef returnType = parser.parseType();
            String name = parser.expectIdentifier("Expected function name");
            return parseFunctionRest(loc, attributes, visibility, returnType, name, false);
        }

        throw new ParseException("Expected item declaration", parser.current, "declaration");
    }

    // ============ 属性与宏 ============

    private boolean isDefineDirective() {
        Token next = parser.peek(1);
        return next.getType() == IDENTIFIER && "define".equals(next.getLexeme());
    }

    /**
     * #[name] / #[name(arg, arg)]，可连续多个
     */
    private List<Attribute> parseAttributes() {
        List<Attribute> attributes = new ArrayList<Attribute>();
        while (parser.check(HASH) && parser.checkAhead(LBRACKET)) {
            SourceLocation loc = parser.location();
            parser.advance(); // consume #
            parser.advance(); // consume [
            if (!parser.check(IDENTIFIER) && !parser.current.getType().isKeyword()) {
                throw new ParseException("Expected attribute name", parser.current, "IDENTIFIER");
            }
            String name = parser.advance().getLexeme();

            List<String> args = new ArrayList<String>();
            if (parser.match(LPAREN)) {
                args = parseAttributeArgs();
            }
            parser.expect(RBRACKET, "Expected ']' after attribute");
            attributes.add(new Attribute(parser.spanFrom(loc), name, args));
        }
        return attributes;
    }

    /**
     * 属性参数按顶层逗号切分，每个参数的 token 以空格连接。消费结尾的 ')'。
     */
    private List<String> parseAttributeArgs() {
        List<String> args = new ArrayList<String>();
        StringBuilder currentArg = new StringBuilder();
        int depth = 0;
        while (true) {
            if (parser.isAtEnd()) {
                throw new ParseException("Unterminated attribute arguments", parser.current, "RPAREN");
            }
            if (depth == 0 && parser.check(RPAREN)) {
                parser.advance();
                break;
            }
            if (depth == 0 && parser.check(COMMA)) {
                parser.advance();
                addAttributeArg(args, currentArg);
                currentArg = new StringBuilder();
                continue;
            }
            if (parser.checkAny(LPAREN, LBRACKET, LBRACE)) {
                depth++;
            } else if (parser.checkAny(RPAREN, RBRACKET, RBRACE)) {
                depth--;
            }
            if (currentArg.length() > 0) {
                currentArg.append(' ');
            }
            currentArg.append(parser.advance().getLexeme());
        }
        addAttributeArg(args, currentArg);
        return args;
    }

    private static void addAttributeArg(List<String> args, StringBuilder arg) {
        if (arg.length() > 0) {
            args.add(arg.toString());
        }
    }

    /**
     * #define __NAME__(a, b) body...，宏体为同一行剩余的 token
     */
    private MacroDefinition parseMacroDefinition() {
        SourceLocation loc = parser.location();
        parser.expect(HASH, "Expected '#'");
        Token define = parser.advance();
        int line = define.getLine();

        if (!parser.check(IDENTIFIER) || parser.current.getLine() != line) {
            throw new ParseException("Expected macro name after #define", parser.current, "IDENTIFIER");
        }
        Token nameToken = parser.advance();

        List<String> params = new ArrayList<String>();
        boolean functionLike = false;
        // 只有名字后紧贴 '(' 才是带参宏
        if (parser.check(LPAREN) && parser.current.getOffset() == nameToken.getEndOffset()) {
            functionLike = true;
            parser.advance();
            if (!parser.check(RPAREN)) {
                do {
                    params.add(parser.expectIdentifier("Expected macro parameter name"));
                } while (parser.match(COMMA));
            }
            parser.expect(RPAREN, "Expected ')' after macro parameters");
        }

        List<Token> body = new ArrayList<Token>();
        while (!parser.isAtEnd() && parser.current.getLine() == line) {
            body.add(parser.advance());
        }
        return new MacroDefinition(parser.spanFrom(loc), nameToken.getLexeme(), params, functionLike, body);
    }

    // ============ 类型声明 ============

    /**
     * struct Name { Type field; RetType method(params) { ... } }
     */
    private StructDecl parseStruct(SourceLocation loc, List<Attribute> attributes, Visibility visibility) {
        parser.expect(KW_STRUCT, "Expected 'struct'");
        String name = parser.expectIdentifier("Expected struct name");
        parser.expect(LBRACE, "Expected '{' after struct name");

        List<FieldDecl> fields = new ArrayList<FieldDecl>();
        List<FunctionDecl> methods = new ArrayList<FunctionDecl>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation memberLoc = parser.location();
            List<Attribute> memberAttrs = parseAttributes();
            Visibility memberVis = parser.match(KW_STATIC) ? Visibility.PRIVATE : Visibility.PUBLIC;
            TypeRef type = parser.parseType();
            String memberName = parser.expectIdentifier("Expected field or method name");
            if (parser.check(LPAREN)) {
                methods.add(parseFunctionRest(memberLoc, memberAttrs, memberVis, type, memberName, false));
            } else {
                if (memberVis == Visibility.PRIVATE) {
                    throw new ParseException("'static' is not allowed on fields", parser.previous);
                }
                parser.expect(SEMICOLON, "Expected ';' after field");
                fields.add(new FieldDecl(parser.spanFrom(memberLoc), memberName, type));
            }
        }
        parser.expect(RBRACE, "Expected '}' after struct body");
        parser.match(SEMICOLON);
        return new StructDecl(parser.spanFrom(loc), attributes, visibility, name, fields, methods);
    }

    /**
     * enum Name { A, B = 5, C }，未显式赋值的成员从上一个值递增
     */
    private EnumDecl parseEnum(SourceLocation loc, List<Attribute> attributes, Visibility visibility) {
        parser.expect(KW_ENUM, "Expected 'enum'");
        String name = parser.expectIdentifier("Expected enum name");
        parser.expect(LBRACE, "Expected '{' after enum name");

        List<EnumVariant> variants = new ArrayList<EnumVariant>();
        long next = 0;
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation variantLoc = parser.location();
            String variantName = parser.expectIdentifier("Expected enum variant name");
            Long explicit = null;
            if (parser.match(ASSIGN)) {
                boolean negative = parser.match(MINUS);
                Token value = parser.expect(INT_LITERAL, "Expected integer value for enum variant");
                long number = ((Long) value.getLiteral()).longValue();
                explicit = Long.valueOf(negative ? -number : number);
            }
            long value = explicit != null ? explicit.longValue() : next;
            variants.add(new EnumVariant(parser.spanFrom(variantLoc), variantName, explicit, value));
            next = value + 1;
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(RBRACE, "Expected '}' after enum variants");
        parser.match(SEMICOLON);
        return new EnumDecl(parser.spanFrom(loc), attributes, visibility, name, variants);
    }

    /**
     * typedef Type Name; 或方法块 typedef struct { ... } @Type[.suffix];
     */
    private Item parseTypedef(SourceLocation loc, List<Attribute> attributes, Visibility visibility) {
        parser.expect(KW_TYPEDEF, "Expected 'typedef'");

        if (parser.check(KW_STRUCT) && parser.checkAhead(LBRACE)) {
            return parseImplBlock(loc, attributes);
        }

        TypeRef target = parser.parseType();
        String name = parser.expectIdentifier("Expected typedef name");
        parser.expect(SEMICOLON, "Expected ';' after typedef");
        return new TypedefDecl(parser.spanFrom(loc), attributes, visibility, name, target);
    }

    private ImplBlockDecl parseImplBlock(SourceLocation loc, List<Attribute> attributes) {
        parser.expect(KW_STRUCT, "Expected 'struct'");
        parser.expect(LBRACE, "Expected '{'");

        List<FunctionDecl> methods = new ArrayList<FunctionDecl>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation memberLoc = parser.location();
            List<Attribute> memberAttrs = parseAttributes();
            Visibility memberVis = parser.match(KW_STATIC) ? Visibility.PRIVATE : Visibility.PUBLIC;
            TypeRef returnType = parser.parseType();
            String name = parser.expectIdentifier("Expected method name");
            if (!parser.check(LPAREN)) {
                throw new ParseException("Method blocks may only contain methods", parser.current, "LPAREN");
            }
            methods.add(parseFunctionRest(memberLoc, memberAttrs, memberVis, returnType, name, false));
        }
        parser.expect(RBRACE, "Expected '}' after method block");

        parser.expect(AT, "Expected '@Type' after method block");
        TypeRef target = parser.typeParser.parseBaseType();
        String blockName = null;
        if (parser.match(DOT)) {
            blockName = parser.expectIdentifier("Expected method block name after '.'");
        }
        parser.expect(SEMICOLON, "Expected ';' after method block");
        return new ImplBlockDecl(parser.spanFrom(loc), attributes, target, blockName, methods);
    }

    /**
     * extern "C" { Type f(params); ... }
     */
    private ExternBlockDecl parseExternBlock(SourceLocation loc, List<Attribute> attributes) {
        parser.expect(KW_EXTERN, "Expected 'extern'");
        Token abiToken = parser.expect(STRING_LITERAL, "Expected ABI string after 'extern'");
        String abi = (String) abiToken.getLiteral();
        parser.expect(LBRACE, "Expected '{' after extern ABI");

        List<FunctionDecl> functions = new ArrayList<FunctionDecl>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation sigLoc = parser.location();
            TypeRef returnType = parser.parseType();
            String name = parser.expectIdentifier("Expected function name");
            List<Parameter> params = parseParameters();
            parser.expect(SEMICOLON, "Expected ';' after extern function signature");
            functions.add(new FunctionDecl(parser.spanFrom(sigLoc), Collections.<Attribute>emptyList(),
                    Visibility.PUBLIC, name, params, returnType, null, false));
        }
        parser.expect(RBRACE, "Expected '}' after extern block");
        return new ExternBlockDecl(parser.spanFrom(loc), attributes, abi, functions);
    }

    /**
     * const Type NAME = value;
     */
    private ConstDecl parseConst(SourceLocation loc, List<Attribute> attributes, Visibility visibility) {
        parser.expect(KW_CONST, "Expected 'const'");
        TypeRef type = parser.parseType();
        String name = parser.expectIdentifier("Expected constant name");
        parser.expect(ASSIGN, "Constant '" + name + "' requires a value");
        Expression value = parser.parseNonCommaExpression();
        if (value instanceof StructInitExpr && !((StructInitExpr) value).hasType()) {
            value = ((StructInitExpr) value).withType(type);
        }
        parser.expect(SEMICOLON, "Expected ';' after constant");
        return new ConstDecl(parser.spanFrom(loc), attributes, visibility, name, type, value);
    }

    // ============ 函数 ============

    /**
     * 函数的参数列表与函数体（返回类型与名字已消费）
     */
    FunctionDecl parseFunctionRest(SourceLocation loc, List<Attribute> attributes, Visibility visibility,
                                   TypeRef returnType, String name, boolean nested) {
        List<Parameter> params = parseParameters();
        Block body = parser.parseBlock();
        return new FunctionDecl(parser.spanFrom(loc), attributes, visibility, name, params, returnType,
                body, nested);
    }

    /**
     * (params)：{@code (void)}、接收者 self / &self / &var self、Type name
     */
    List<Parameter> parseParameters() {
        parser.expect(LPAREN, "Expected '(' before parameters");
        List<Parameter> params = new ArrayList<Parameter>();

        if (parser.check(KW_VOID) && parser.checkAhead(RPAREN)) {
            parser.advance();
            parser.advance();
            return params;
        }

        if (!parser.check(RPAREN)) {
            do {
                params.add(parseParameter(params.isEmpty()));
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after parameters");
        return params;
    }

    private Parameter parseParameter(boolean first) {
        SourceLocation loc = parser.location();
        Parameter.SelfKind selfKind = parseReceiver();
        if (selfKind != Parameter.SelfKind.NONE) {
            if (!first) {
                throw new ParseException("'self' must be the first parameter", parser.previous);
            }
            return Parameter.receiver(parser.spanFrom(loc), selfKind);
        }
        TypeRef type = parser.parseType();
        String name = parser.expectIdentifier("Expected parameter name");
        return new Parameter(parser.spanFrom(loc), name, type);
    }

    private Parameter.SelfKind parseReceiver() {
        if (parser.match(KW_SELF)) {
            return Parameter.SelfKind.VALUE;
        }
        if (parser.check(AMP) && parser.checkAhead(KW_SELF)) {
            parser.advance();
            parser.advance();
            return Parameter.SelfKind.REF;
        }
        if (parser.check(AMP) && parser.checkAhead(KW_VAR) && parser.peek(2).getType() == KW_SELF) {
            parser.advance();
            parser.advance();
            parser.advance();
            return Parameter.SelfKind.REF_MUT;
        }
        return Parameter.SelfKind.NONE;
    }
}
