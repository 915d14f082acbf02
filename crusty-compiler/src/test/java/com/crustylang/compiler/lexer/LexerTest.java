package com.crustylang.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 非 EOF token */
    private List<Token> tokens(String source) {
        return scan(source).stream()
                .filter(t -> t.getType() != TokenType.EOF)
                .collect(Collectors.toList());
    }

    private List<TokenType> types(String source) {
        return tokens(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    private String scanWithErrors(String source) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos, true, StandardCharsets.UTF_8);
        new Lexer(source, "<test>", ps).scanTokens();
        return baos.toString(StandardCharsets.UTF_8);
    }

    private void assertSingleToken(String source, TokenType expected) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expected, toks.get(0).getType());
    }

    private void assertSingleToken(String source, TokenType expectedType, Object expectedLiteral) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expectedType, toks.get(0).getType());
        assertEquals(expectedLiteral, toks.get(0).getLiteral());
    }

    @Nested
    @DisplayName("运算符")
    class OperatorTests {

        @Test
        @DisplayName("多字符运算符按最长匹配")
        void testLongestMatch() {
            assertSingleToken("++", TokenType.INC);
            assertSingleToken("--", TokenType.DEC);
            assertSingleToken("->", TokenType.ARROW);
            assertSingleToken("::", TokenType.DOUBLE_COLON);
            assertSingleToken("..", TokenType.RANGE);
            assertSingleToken("..=", TokenType.RANGE_INCLUSIVE);
            assertSingleToken("<<=", TokenType.SHL_ASSIGN);
            assertSingleToken(">>", TokenType.SHR);
            assertSingleToken("&&", TokenType.AND);
            assertSingleToken("&=", TokenType.AND_ASSIGN);
            assertSingleToken("||", TokenType.OR);
            assertSingleToken("!=", TokenType.NE);
        }

        @Test
        @DisplayName("单字符 token")
        void testSingleChars() {
            assertEquals(java.util.Arrays.asList(TokenType.AT, TokenType.HASH, TokenType.QUESTION,
                    TokenType.TILDE, TokenType.LBRACKET, TokenType.RBRACKET), types("@ # ? ~ [ ]"));
        }

        @Test
        @DisplayName("类型限定调用拆成 @ 标识符 . 标识符")
        void testTypeScopedCall() {
            assertEquals(java.util.Arrays.asList(TokenType.AT, TokenType.IDENTIFIER, TokenType.DOT,
                    TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.RPAREN), types("@Vec.new()"));
        }
    }

    @Nested
    @DisplayName("关键词与标识符")
    class KeywordTests {

        @Test
        @DisplayName("内置类型关键词")
        void testPrimitiveKeywords() {
            assertSingleToken("int", TokenType.KW_INT);
            assertSingleToken("float", TokenType.KW_FLOAT);
            assertSingleToken("void", TokenType.KW_VOID);
            assertSingleToken("auto", TokenType.KW_AUTO);
            assertTrue(TokenType.KW_U64.isPrimitiveType());
            assertFalse(TokenType.KW_AUTO.isPrimitiveType());
        }

        @Test
        @DisplayName("NULL 区分大小写")
        void testNullKeyword() {
            assertSingleToken("NULL", TokenType.KW_NULL);
            assertSingleToken("null", TokenType.IDENTIFIER);
        }

        @Test
        @DisplayName("宏名中的双下划线属于标识符")
        void testMacroName() {
            assertSingleToken("__println__", TokenType.IDENTIFIER);
        }

        @Test
        @DisplayName("关键词集合")
        void testKeywordSet() {
            assertTrue(Lexer.getKeywords().contains("typedef"));
            assertTrue(Lexer.getKeywords().contains("sizeof"));
            assertFalse(Lexer.getKeywords().contains("fn"));
        }
    }

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("整数与进制")
        void testIntegers() {
            assertSingleToken("42", TokenType.INT_LITERAL, 42L);
            assertSingleToken("1_000", TokenType.INT_LITERAL, 1000L);
            assertSingleToken("0xFF", TokenType.INT_LITERAL, 255L);
            assertSingleToken("0b101", TokenType.INT_LITERAL, 5L);
        }

        @Test
        @DisplayName("浮点数与指数")
        void testFloats() {
            assertSingleToken("3.14", TokenType.FLOAT_LITERAL, 3.14);
            assertSingleToken("1e3", TokenType.FLOAT_LITERAL, 1000.0);
        }

        @Test
        @DisplayName("范围运算符不吞掉小数点")
        void testRangeAfterInteger() {
            assertEquals(java.util.Arrays.asList(TokenType.INT_LITERAL, TokenType.RANGE, TokenType.INT_LITERAL),
                    types("0..10"));
        }

        @Test
        @DisplayName("字符串与转义")
        void testStrings() {
            assertSingleToken("\"a\\nb\"", TokenType.STRING_LITERAL, "a\nb");
            assertSingleToken("'x'", TokenType.CHAR_LITERAL, 'x');
            assertSingleToken("'\\t'", TokenType.CHAR_LITERAL, '\t');
        }
    }

    @Nested
    @DisplayName("注释与位置")
    class PositionTests {

        @Test
        @DisplayName("注释不产生 token，嵌套块注释")
        void testComments() {
            assertEquals(java.util.Arrays.asList(TokenType.IDENTIFIER, TokenType.IDENTIFIER),
                    types("a // line\n/* outer /* inner */ still */ b"));
        }

        @Test
        @DisplayName("行列号从 1 开始")
        void testLineAndColumn() {
            List<Token> toks = tokens("int x\n  = 5;");
            assertEquals(1, toks.get(0).getLine());
            assertEquals(1, toks.get(0).getColumn());
            assertEquals(5, toks.get(1).getColumn());
            Token assign = toks.get(2);
            assertEquals(TokenType.ASSIGN, assign.getType());
            assertEquals(2, assign.getLine());
            assertEquals(3, assign.getColumn());
        }

        @Test
        @DisplayName("输入结束后持续返回 EOF")
        void testEofRepeats() {
            Lexer lexer = new Lexer("x");
            assertEquals(TokenType.IDENTIFIER, lexer.nextToken().getType());
            assertEquals(TokenType.EOF, lexer.nextToken().getType());
            assertEquals(TokenType.EOF, lexer.nextToken().getType());
        }
    }

    @Nested
    @DisplayName("词法错误")
    class ErrorTests {

        @Test
        @DisplayName("未闭合字符串报告错误 token")
        void testUnterminatedString() {
            String errors = scanWithErrors("\"abc");
            assertTrue(errors.contains("Unterminated string"), errors);
            assertTrue(errors.contains("<test>:1:"), errors);
        }

        @Test
        @DisplayName("非法字符")
        void testUnexpectedCharacter() {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            Lexer lexer = new Lexer("a $ b", "<test>", new PrintStream(baos, true, StandardCharsets.UTF_8));
            List<Token> toks = lexer.scanTokens();
            assertEquals(1, lexer.getErrorCount());
            assertTrue(toks.stream().anyMatch(t -> t.getType() == TokenType.ERROR));
            assertTrue(baos.toString(StandardCharsets.UTF_8).contains("Unexpected character: $"));
        }
    }
}
