package com.crustylang.compiler.parser;

import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.type.*;
import com.crustylang.compiler.lexer.Token;
import com.crustylang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.crustylang.compiler.lexer.TokenType.*;

/**
 * 类型解析辅助类
 *
 * <pre>
 * type     := ('*' | '&amp;') 'var'? type | base suffix*
 * base     := primitive | 'auto' | Ident ('&lt;' type (',' type)* '&gt;')? | '(' types? ')'
 * suffix   := '[' INT ']' | '[' ']' | '?'
 * </pre>
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 当前 token 能否开始一个类型
     */
    boolean canStartType() {
        TokenType type = parser.current.getType();
        return type.isPrimitiveType() || type == KW_AUTO || type == IDENTIFIER
                || type == STAR || type == AMP || type == AND || type == LPAREN;
    }

    TypeRef parseType() {
        SourceLocation loc = parser.location();

        // 裸指针 *T / *var T
        if (parser.match(STAR)) {
            boolean mutable = parser.match(KW_VAR);
            TypeRef inner = parseType();
            return new PointerType(parser.spanFrom(loc), inner, mutable);
        }

        // 引用 &T / &var T
        if (parser.match(AMP)) {
            boolean mutable = parser.match(KW_VAR);
            TypeRef inner = parseType();
            return new ReferenceType(parser.spanFrom(loc), inner, mutable);
        }

        // '&&' 是两层引用
        if (parser.match(AND)) {
            boolean mutable = parser.match(KW_VAR);
            TypeRef inner = parseType();
            SourceLocation span = parser.spanFrom(loc);
            return new ReferenceType(span, new ReferenceType(span, inner, mutable), false);
        }

        TypeRef type = parseBaseType();
        return parseTypeSuffixes(loc, type);
    }

    private TypeRef parseTypeSuffixes(SourceLocation loc, TypeRef type) {
        while (true) {
            if (parser.check(LBRACKET)) {
                parser.advance();
                if (parser.match(RBRACKET)) {
                    type = new SliceType(parser.spanFrom(loc), type);
                } else {
                    Token size = parser.expect(INT_LITERAL, "Expected array size");
                    parser.expect(RBRACKET, "Expected ']' after array size");
                    type = new ArrayType(parser.spanFrom(loc), type, ((Long) size.getLiteral()).longValue());
                }
            } else if (parser.check(QUESTION)) {
                parser.advance();
                type = new FallibleType(parser.spanFrom(loc), type);
            } else {
                return type;
            }
        }
    }

    /**
     * 基础类型（不含前缀与后缀）
     */
    TypeRef parseBaseType() {
        SourceLocation loc = parser.location();
        TokenType tokenType = parser.current.getType();

        if (tokenType.isPrimitiveType()) {
            parser.advance();
            return new PrimitiveType(loc, primitiveKind(tokenType));
        }

        if (parser.match(KW_AUTO)) {
            return new AutoType(loc);
        }

        if (parser.check(IDENTIFIER)) {
            String name = parser.advance().getLexeme();
            TypeRef base = new NamedType(loc, name);
            if (parser.check(LT)) {
                List<TypeRef> args = parseTypeArgs();
                return new GenericType(parser.spanFrom(loc), base, args);
            }
            return base;
        }

        if (parser.match(LPAREN)) {
            // () 为空元组；(T) 为带括号的类型；(T,) / (T, U) 为元组
            if (parser.match(RPAREN)) {
                return new TupleType(parser.spanFrom(loc), Collections.<TypeRef>emptyList());
            }
            TypeRef first = parseType();
            if (parser.match(RPAREN)) {
                return first;
            }
            List<TypeRef> elements = new ArrayList<TypeRef>();
            elements.add(first);
            while (parser.match(COMMA)) {
                if (parser.check(RPAREN)) break;  // 尾随逗号
                elements.add(parseType());
            }
            parser.expect(RPAREN, "Expected ')' after tuple type");
            return new TupleType(parser.spanFrom(loc), elements);
        }

        throw new ParseException("Expected type", parser.current, "type");
    }

    /**
     * 类型实参列表 {@code <A, B>}
     */
    List<TypeRef> parseTypeArgs() {
        parser.expect(LT, "Expected '<'");
        List<TypeRef> args = new ArrayList<TypeRef>();
        do {
            args.add(parseType());
        } while (parser.match(COMMA));
        expectCloseAngle();
        return args;
    }

    /**
     * 结束类型实参；嵌套泛型的 '>>' 拆为两个 '>'
     */
    private void expectCloseAngle() {
        if (parser.check(SHR)) {
            parser.splitShiftRight();
        }
        parser.expect(GT, "Expected '>' after type arguments");
    }

    /**
     * 括号内的类型列表（{@code @Vec(int).new()} 的显式泛型）
     */
    List<TypeRef> parseParenthesizedTypeList() {
        parser.expect(LPAREN, "Expected '('");
        List<TypeRef> types = new ArrayList<TypeRef>();
        if (!parser.check(RPAREN)) {
            do {
                types.add(parseType());
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after type list");
        return types;
    }

    static PrimitiveKind primitiveKind(TokenType type) {
        switch (type) {
            case KW_INT: return PrimitiveKind.INT;
            case KW_I32: return PrimitiveKind.I32;
            case KW_I64: return PrimitiveKind.I64;
            case KW_U32: return PrimitiveKind.U32;
            case KW_U64: return PrimitiveKind.U64;
            case KW_FLOAT: return PrimitiveKind.FLOAT;
            case KW_F32: return PrimitiveKind.F32;
            case KW_F64: return PrimitiveKind.F64;
            case KW_BOOL: return PrimitiveKind.BOOL;
            case KW_CHAR: return PrimitiveKind.CHAR;
            case KW_VOID: return PrimitiveKind.VOID;
            default:
                throw new IllegalArgumentException("Not a primitive type keyword: " + type);
        }
    }
}
