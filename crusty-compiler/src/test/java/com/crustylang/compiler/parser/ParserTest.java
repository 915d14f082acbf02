package com.crustylang.compiler.parser;

import com.crustylang.compiler.ast.Visibility;
import com.crustylang.compiler.ast.decl.*;
import com.crustylang.compiler.ast.expr.*;
import com.crustylang.compiler.ast.stmt.*;
import com.crustylang.compiler.ast.type.*;
import com.crustylang.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private CompilationUnit parse(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>").parse();
    }

    private Expression expr(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>").parseStandaloneExpression();
    }

    private Statement stmt(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>").parseStandaloneStatement();
    }

    private <T> T firstItem(String source, Class<T> type) {
        CompilationUnit unit = parse(source);
        assertFalse(unit.getItems().isEmpty(), "no items parsed");
        Item item = unit.getItems().get(0);
        assertInstanceOf(type, item);
        return type.cast(item);
    }

    // ================================================================
    // 类型转换 / 括号 / 元组
    // ================================================================

    @Nested
    @DisplayName("类型转换与括号歧义")
    class CastDisambiguationTests {

        @Test
        @DisplayName("(int)(x) 是类型转换")
        void testCastOfParenthesized() {
            Expression e = expr("(int)(x)");
            CastExpr cast = assertInstanceOf(CastExpr.class, e);
            assertEquals(new PrimitiveType(PrimitiveKind.INT), cast.getTargetType());
            assertInstanceOf(ParenExpr.class, cast.getOperand());
        }

        @Test
        @DisplayName("(int)x 是类型转换")
        void testCastOfIdentifier() {
            CastExpr cast = assertInstanceOf(CastExpr.class, expr("(int)x"));
            assertEquals("x", assertInstanceOf(Identifier.class, cast.getOperand()).getName());
        }

        @Test
        @DisplayName("(x) 是括号表达式")
        void testParenthesized() {
            ParenExpr paren = assertInstanceOf(ParenExpr.class, expr("(x)"));
            assertInstanceOf(Identifier.class, paren.getInner());
        }

        @Test
        @DisplayName("(x, y) 是元组")
        void testTuple() {
            TupleLiteralExpr tuple = assertInstanceOf(TupleLiteralExpr.class, expr("(x, y)"));
            assertEquals(2, tuple.getElements().size());
        }

        @Test
        @DisplayName("() 是空元组，(x,) 是单元素元组")
        void testUnitAndSingleTuple() {
            assertTrue(assertInstanceOf(TupleLiteralExpr.class, expr("()")).getElements().isEmpty());
            assertEquals(1, assertInstanceOf(TupleLiteralExpr.class, expr("(x,)")).getElements().size());
        }

        @Test
        @DisplayName("(x) - y 是减法而非对取负值的转换")
        void testBareNameMinus() {
            BinaryExpr bin = assertInstanceOf(BinaryExpr.class, expr("(x) - y"));
            assertEquals(BinaryExpr.BinaryOp.SUB, bin.getOperator());
            assertInstanceOf(ParenExpr.class, bin.getLeft());
        }

        @Test
        @DisplayName("原始类型后的一元负号仍是转换")
        void testPrimitiveCastOfNegative() {
            CastExpr cast = assertInstanceOf(CastExpr.class, expr("(i64)-x"));
            assertEquals(UnaryExpr.UnaryOp.NEG, assertInstanceOf(UnaryExpr.class, cast.getOperand()).getOperator());
        }

        @Test
        @DisplayName("指针类型转换")
        void testPointerCast() {
            CastExpr cast = assertInstanceOf(CastExpr.class, expr("(*var u8)p"));
            PointerType ptr = assertInstanceOf(PointerType.class, cast.getTargetType());
            assertTrue(ptr.isMutable());
            assertEquals("u8", assertInstanceOf(NamedType.class, ptr.getInner()).getName());
        }

        @Test
        @DisplayName("别名类型转换：(Meters)5")
        void testAliasCast() {
            CastExpr cast = assertInstanceOf(CastExpr.class, expr("(Meters)5"));
            assertEquals("Meters", assertInstanceOf(NamedType.class, cast.getTargetType()).getName());
        }

        @Test
        @DisplayName("转换优先级高于乘法")
        void testCastBindsTighter() {
            BinaryExpr bin = assertInstanceOf(BinaryExpr.class, expr("(float)a * b"));
            assertEquals(BinaryExpr.BinaryOp.MUL, bin.getOperator());
            assertInstanceOf(CastExpr.class, bin.getLeft());
        }
    }

    // ================================================================
    // 声明与表达式语句
    // ================================================================

    @Nested
    @DisplayName("声明语句")
    class DeclarationTests {

        @Test
        @DisplayName("int x = 5; 是隐式不可变声明")
        void testImplicitDeclaration() {
            LetStmt let = assertInstanceOf(LetStmt.class, stmt("int x = 5;"));
            assertEquals("x", let.getName());
            assertEquals(LetStmt.Kind.LET, let.getKind());
            assertFalse(let.isMutable());
            assertEquals(new PrimitiveType(PrimitiveKind.INT), let.getType());
        }

        @Test
        @DisplayName("x = 5; 是赋值表达式语句")
        void testAssignment() {
            ExpressionStmt es = assertInstanceOf(ExpressionStmt.class, stmt("x = 5;"));
            AssignExpr assign = assertInstanceOf(AssignExpr.class, es.getExpression());
            assertEquals(AssignExpr.AssignOp.ASSIGN, assign.getOperator());
        }

        @Test
        @DisplayName("四种写法得到等价的声明")
        void testEquivalentForms() {
            LetStmt implicit = assertInstanceOf(LetStmt.class, stmt("int x = 5;"));
            LetStmt typed = assertInstanceOf(LetStmt.class, stmt("let int x = 5;"));
            LetStmt annotated = assertInstanceOf(LetStmt.class, stmt("let x: int = 5;"));
            LetStmt inferred = assertInstanceOf(LetStmt.class, stmt("let x = 5;"));
            for (LetStmt let : new LetStmt[]{implicit, typed, annotated, inferred}) {
                assertEquals("x", let.getName());
                assertEquals(LetStmt.Kind.LET, let.getKind());
                assertTrue(let.hasInitializer());
            }
            assertEquals(implicit.getType(), typed.getType());
            assertEquals(implicit.getType(), annotated.getType());
            assertFalse(inferred.hasType());
        }

        @Test
        @DisplayName("var 引入可变绑定")
        void testMutableBinding() {
            LetStmt let = assertInstanceOf(LetStmt.class, stmt("var int count = 0;"));
            assertEquals(LetStmt.Kind.VAR, let.getKind());
            assertTrue(let.isMutable());
        }

        @Test
        @DisplayName("const 必须有初始值")
        void testConstRequiresValue() {
            assertThrows(ParseException.class, () -> stmt("const int N;"));
        }

        @Test
        @DisplayName("a * b; 是表达式语句")
        void testMultiplicationStatement() {
            ExpressionStmt es = assertInstanceOf(ExpressionStmt.class, stmt("a * b;"));
            assertInstanceOf(BinaryExpr.class, es.getExpression());
        }

        @Test
        @DisplayName("泛型类型的声明")
        void testGenericDeclaration() {
            LetStmt let = assertInstanceOf(LetStmt.class, stmt("Vec<Vec<int>> grid = @Vec.new();"));
            GenericType outer = assertInstanceOf(GenericType.class, let.getType());
            assertInstanceOf(GenericType.class, outer.getTypeArgs().get(0));
            assertInstanceOf(TypeScopedCallExpr.class, let.getInitializer());
        }

        @Test
        @DisplayName("结构体初始化取声明类型")
        void testStructInitTakesDeclaredType() {
            LetStmt let = assertInstanceOf(LetStmt.class, stmt("Point p = { .x = 1, .y = 2 };"));
            StructInitExpr init = assertInstanceOf(StructInitExpr.class, let.getInitializer());
            assertTrue(init.hasType());
            assertEquals(2, init.getFields().size());
        }

        @Test
        @DisplayName("类型开头的嵌套函数")
        void testNestedFunction() {
            NestedFunctionStmt nested = assertInstanceOf(NestedFunctionStmt.class,
                    stmt("int add(int a, int b) { return a + b; }"));
            assertTrue(nested.getFunction().isNested());
            assertEquals(2, nested.getFunction().getParams().size());
        }

        @Test
        @DisplayName("调用语句不是嵌套函数")
        void testCallStatement() {
            ExpressionStmt es = assertInstanceOf(ExpressionStmt.class, stmt("foo(a, b);"));
            assertInstanceOf(CallExpr.class, es.getExpression());
        }
    }

    // ================================================================
    // 运算符
    // ================================================================

    @Nested
    @DisplayName("运算符优先级")
    class PrecedenceTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testArithmetic() {
            BinaryExpr add = assertInstanceOf(BinaryExpr.class, expr("a + b * c"));
            assertEquals(BinaryExpr.BinaryOp.ADD, add.getOperator());
            assertEquals(BinaryExpr.BinaryOp.MUL, assertInstanceOf(BinaryExpr.class, add.getRight()).getOperator());
        }

        @Test
        @DisplayName("逻辑与优先于逻辑或")
        void testLogical() {
            BinaryExpr or = assertInstanceOf(BinaryExpr.class, expr("a || b && c"));
            assertEquals(BinaryExpr.BinaryOp.OR, or.getOperator());
        }

        @Test
        @DisplayName("逗号表达式最低且左结合")
        void testComma() {
            CommaExpr comma = assertInstanceOf(CommaExpr.class, expr("a = 1, b = 2, c"));
            assertEquals(3, comma.getExpressions().size());
            assertInstanceOf(AssignExpr.class, comma.getExpressions().get(0));
        }

        @Test
        @DisplayName("三元表达式右结合")
        void testTernary() {
            ConditionalExpr cond = assertInstanceOf(ConditionalExpr.class, expr("a ? b : c ? d : e"));
            assertInstanceOf(ConditionalExpr.class, cond.getElseExpr());
        }

        @Test
        @DisplayName("前缀自增")
        void testPrefixIncrement() {
            UnaryExpr inc = assertInstanceOf(UnaryExpr.class, expr("++i"));
            assertEquals(UnaryExpr.UnaryOp.PRE_INC, inc.getOperator());
        }

        @Test
        @DisplayName("不支持后缀自增")
        void testPostfixIncrementRejected() {
            ParseException e = assertThrows(ParseException.class, () -> expr("i++"));
            assertTrue(e.getRawMessage().contains("prefix"), e.getMessage());
        }

        @Test
        @DisplayName("&var 取可变引用，&& 是两层引用")
        void testReferences() {
            assertEquals(UnaryExpr.UnaryOp.REF_MUT, assertInstanceOf(UnaryExpr.class, expr("&var x")).getOperator());
            UnaryExpr outer = assertInstanceOf(UnaryExpr.class, expr("&&x"));
            assertEquals(UnaryExpr.UnaryOp.REF, outer.getOperator());
            assertEquals(UnaryExpr.UnaryOp.REF, assertInstanceOf(UnaryExpr.class, outer.getOperand()).getOperator());
        }

        @Test
        @DisplayName("p->f 即 (*p).f")
        void testArrow() {
            FieldAccessExpr access = assertInstanceOf(FieldAccessExpr.class, expr("p->x"));
            assertEquals(UnaryExpr.UnaryOp.DEREF, assertInstanceOf(UnaryExpr.class, access.getTarget()).getOperator());
        }
    }

    // ================================================================
    // 错误传播与三元 ?
    // ================================================================

    @Nested
    @DisplayName("? 运算符")
    class QuestionTests {

        @Test
        @DisplayName("语句末尾的 ? 是错误传播")
        void testPropagation() {
            ExpressionStmt es = assertInstanceOf(ExpressionStmt.class, stmt("read(path)?;"));
            assertInstanceOf(ErrorPropagationExpr.class, es.getExpression());
        }

        @Test
        @DisplayName("链式调用中的 ?")
        void testPropagationInChain() {
            MethodCallExpr call = assertInstanceOf(MethodCallExpr.class, expr("open(p)?.read()"));
            assertInstanceOf(ErrorPropagationExpr.class, call.getReceiver());
        }

        @Test
        @DisplayName("后面有 ':' 的 ? 是三元")
        void testTernaryNotPropagation() {
            assertInstanceOf(ConditionalExpr.class, expr("ok ? f(x) : 0"));
        }
    }

    // ================================================================
    // 顶层声明
    // ================================================================

    @Nested
    @DisplayName("顶层声明")
    class ItemTests {

        @Test
        @DisplayName("函数默认公开，static 为私有")
        void testFunctionVisibility() {
            CompilationUnit unit = parse("int f(void) { return 1; }\nstatic void g() {}");
            assertEquals(Visibility.PUBLIC, unit.getItems().get(0).getVisibility());
            assertEquals(Visibility.PRIVATE, unit.getItems().get(1).getVisibility());
            assertTrue(((FunctionDecl) unit.getItems().get(0)).getParams().isEmpty());
        }

        @Test
        @DisplayName("typedef 别名")
        void testTypedef() {
            TypedefDecl typedef = firstItem("typedef *int IntPtr;", TypedefDecl.class);
            assertEquals("IntPtr", typedef.getName());
            assertInstanceOf(PointerType.class, typedef.getTarget());
        }

        @Test
        @DisplayName("typedef struct 方法块")
        void testImplBlock() {
            ImplBlockDecl impl = firstItem(
                    "typedef struct { int area(&self) { return self.w * self.h; } } @Rect.geometry;",
                    ImplBlockDecl.class);
            assertEquals("geometry", impl.getBlockName());
            assertEquals("Rect", assertInstanceOf(NamedType.class, impl.getTargetType()).getName());
            assertEquals(Parameter.SelfKind.REF, impl.getMethods().get(0).getParams().get(0).getSelfKind());
        }

        @Test
        @DisplayName("结构体字段与方法")
        void testStruct() {
            StructDecl struct = firstItem(
                    "struct Point { int x; int y; int sum(&self) { return self.x + self.y; } }",
                    StructDecl.class);
            assertEquals(2, struct.getFields().size());
            assertEquals(1, struct.getMethods().size());
            assertNotNull(struct.findField("y"));
        }

        @Test
        @DisplayName("枚举值从上一个值递增")
        void testEnum() {
            EnumDecl decl = firstItem("enum Color { Red, Green = 5, Blue }", EnumDecl.class);
            assertEquals(0, decl.getVariants().get(0).getValue());
            assertEquals(5, decl.getVariants().get(1).getValue());
            assertEquals(6, decl.getVariants().get(2).getValue());
            assertFalse(decl.getVariants().get(2).hasExplicitValue());
        }

        @Test
        @DisplayName("extern 块")
        void testExtern() {
            ExternBlockDecl ext = firstItem("extern \"C\" { int abs(int x); }", ExternBlockDecl.class);
            assertEquals("C", ext.getAbi());
            assertFalse(ext.getFunctions().get(0).hasBody());
        }

        @Test
        @DisplayName("#define 宏占一行")
        void testDefine() {
            CompilationUnit unit = parse("#define __SQUARE__(x) x * x\nint f() { return 1; }");
            MacroDefinition macro = assertInstanceOf(MacroDefinition.class, unit.getItems().get(0));
            assertTrue(macro.isFunctionLike());
            assertEquals(1, macro.getParams().size());
            assertEquals(3, macro.getBody().size());
            assertEquals(2, unit.getItems().size());
        }

        @Test
        @DisplayName("属性")
        void testAttributes() {
            StructDecl struct = firstItem("#[derive(Debug, Clone)]\nstruct P { int x; }", StructDecl.class);
            Attribute attr = struct.getAttributes().get(0);
            assertEquals("derive", attr.getName());
            assertEquals(2, attr.getArgs().size());
        }
    }

    // ================================================================
    // 控制流
    // ================================================================

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("带标签的循环与 break")
        void testLabeledLoop() {
            WhileStmt loop = assertInstanceOf(WhileStmt.class, stmt(".outer: while (true) { break .outer; }"));
            assertEquals("outer", loop.getLabel());
            BreakStmt brk = assertInstanceOf(BreakStmt.class, loop.getBody().getStatements().get(0));
            assertEquals("outer", brk.getLabel());
        }

        @Test
        @DisplayName("C 风格 for")
        void testForLoop() {
            ForStmt loop = assertInstanceOf(ForStmt.class, stmt("for (var int i = 0; i < 10; ++i) { }"));
            assertInstanceOf(LetStmt.class, loop.getInitializer());
            assertNotNull(loop.getCondition());
            assertNotNull(loop.getUpdate());
        }

        @Test
        @DisplayName("for-in 范围")
        void testForIn() {
            ForInStmt loop = assertInstanceOf(ForInStmt.class, stmt("for (i in 0..=10) { }"));
            assertTrue(assertInstanceOf(RangeExpr.class, loop.getIterable()).isInclusive());
        }

        @Test
        @DisplayName("switch 的多值 case 与尾部 break")
        void testSwitch() {
            SwitchStmt sw = assertInstanceOf(SwitchStmt.class,
                    stmt("switch (x) { case 1, 2: y = 1; break; default: y = 0; }"));
            assertEquals(2, sw.getCases().get(0).getValues().size());
            assertEquals(1, sw.getCases().get(0).getBody().getStatements().size());
            assertTrue(sw.hasDefault());
        }

        @Test
        @DisplayName("else if 链")
        void testElseIf() {
            IfStmt stmt = assertInstanceOf(IfStmt.class, stmt("if (a) { } else if (b) { } else { }"));
            IfStmt elseIf = assertInstanceOf(IfStmt.class, stmt.getElseBranch());
            assertInstanceOf(Block.class, elseIf.getElseBranch());
        }
    }

    // ================================================================
    // 错误
    // ================================================================

    @Nested
    @DisplayName("解析错误")
    class ErrorTests {

        @Test
        @DisplayName("错误携带位置与期望")
        void testErrorPosition() {
            ParseException e = assertThrows(ParseException.class, () -> parse("int f() {\n  return 1\n}"));
            assertEquals(3, e.getLine());
            assertEquals(1, e.getColumn());
            assertEquals("SEMICOLON", e.getExpected());
            assertNotNull(e.getFound());
        }

        @Test
        @DisplayName("词法错误成为解析错误")
        void testLexicalError() {
            PrintStream quiet = new PrintStream(new ByteArrayOutputStream());
            ParseException e = assertThrows(ParseException.class,
                    () -> new Parser(new Lexer("int f() { $ }", "<test>", quiet), "<test>").parse());
            assertTrue(e.getRawMessage().startsWith("Lexical error"), e.getMessage());
        }

        @Test
        @DisplayName("范围表达式只能出现在索引与 for-in 中")
        void testStrayRange() {
            assertThrows(ParseException.class, () -> expr("0..10"));
        }
    }
}
