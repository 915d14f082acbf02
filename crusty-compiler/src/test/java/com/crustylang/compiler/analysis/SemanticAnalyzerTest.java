package com.crustylang.compiler.analysis;

import com.crustylang.compiler.ast.decl.CompilationUnit;
import com.crustylang.compiler.ast.decl.FunctionDecl;
import com.crustylang.compiler.ast.decl.Item;
import com.crustylang.compiler.ast.stmt.NestedFunctionStmt;
import com.crustylang.compiler.ast.stmt.Statement;
import com.crustylang.compiler.ast.type.NamedType;
import com.crustylang.compiler.ast.type.PrimitiveKind;
import com.crustylang.compiler.ast.type.PrimitiveType;
import com.crustylang.compiler.lexer.Lexer;
import com.crustylang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 语义分析测试：类型别名、类型检查、嵌套函数捕获分类
 */
class SemanticAnalyzerTest {

    // ============ 测试辅助方法 ============

    private CompilationUnit parse(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>").parse();
    }

    private AnalysisResult analyze(CompilationUnit unit) {
        return new SemanticAnalyzer().analyze(unit);
    }

    private AnalysisResult analyze(String source) {
        return analyze(parse(source));
    }

    private void assertNoErrors(AnalysisResult result) {
        if (result.hasErrors()) {
            StringBuilder sb = new StringBuilder("不应有错误，但发现 " + result.getErrors().size() + " 条:\n");
            for (SemanticError e : result.getErrors()) {
                sb.append("  ").append(e).append('\n');
            }
            fail(sb.toString());
        }
    }

    private void assertError(AnalysisResult result, SemanticError.ErrorKind kind) {
        assertTrue(result.hasError(kind), "缺少 " + kind + "，实际: " + result.getErrors());
    }

    private FunctionDecl function(CompilationUnit unit, String name) {
        for (Item item : unit.getItems()) {
            if (item instanceof FunctionDecl && item.getName().equals(name)) {
                return (FunctionDecl) item;
            }
        }
        throw new AssertionError("function not found: " + name);
    }

    /** 函数体中指定名字的嵌套函数的捕获信息 */
    private CaptureInfo captures(CompilationUnit unit, String outer, String nested) {
        List<Statement> statements = function(unit, outer).getBody().getStatements();
        for (Statement stmt : statements) {
            if (stmt instanceof NestedFunctionStmt
                    && ((NestedFunctionStmt) stmt).getFunction().getName().equals(nested)) {
                CaptureInfo info = ((NestedFunctionStmt) stmt).getFunction().getCaptureInfo();
                assertNotNull(info, "capture info not set for " + nested);
                return info;
            }
        }
        throw new AssertionError("nested function not found: " + nested);
    }

    // ================================================================
    // 类型别名
    // ================================================================

    @Nested
    @DisplayName("类型别名")
    class TypedefTests {

        @Test
        @DisplayName("别名链解析到原始类型，函数被接受")
        void testAliasChain() {
            AnalysisResult result = analyze("typedef int A; typedef A B; int f(B x) { return x; }");
            assertNoErrors(result);
            TypeEnvironment env = result.getEnvironment();
            assertEquals(new PrimitiveType(PrimitiveKind.INT), env.resolveType(new NamedType("B")));
            assertTrue(env.isFrozen());
        }

        @Test
        @DisplayName("通过自身重定义成环被拒绝")
        void testSelfCycle() {
            CompilationUnit unit = parse("typedef int A; typedef A A;");
            AnalysisResult result = analyze(unit);
            assertError(result, SemanticError.ErrorKind.CIRCULAR_TYPE_ALIAS);
            assertTrue(result.isExcluded(unit.getItems().get(1)));
            assertFalse(result.isExcluded(unit.getItems().get(0)));
        }

        @Test
        @DisplayName("互相引用的别名被拒绝")
        void testMutualCycle() {
            AnalysisResult result = analyze("typedef B A; typedef A B;");
            assertError(result, SemanticError.ErrorKind.CIRCULAR_TYPE_ALIAS);
            assertEquals(1, result.getErrors().size());
        }

        @Test
        @DisplayName("前向引用的别名")
        void testForwardAlias() {
            AnalysisResult result = analyze("typedef Meters Distance; typedef int Meters; Distance d(void) { return 5; }");
            assertNoErrors(result);
            assertEquals(new PrimitiveType(PrimitiveKind.INT),
                    result.getEnvironment().resolveType(new NamedType("Distance")));
        }

        @Test
        @DisplayName("重复定义")
        void testDuplicateTypedef() {
            assertError(analyze("typedef int A; typedef float A;"), SemanticError.ErrorKind.DUPLICATE_DEFINITION);
            assertError(analyze("struct P { int x; } typedef int P;"), SemanticError.ErrorKind.DUPLICATE_DEFINITION);
        }

        @Test
        @DisplayName("未定义类型的条目被排除")
        void testUndefinedType() {
            CompilationUnit unit = parse("Widget make(void) { return NULL; } int ok(void) { return 1; }");
            AnalysisResult result = analyze(unit);
            assertError(result, SemanticError.ErrorKind.UNDEFINED_TYPE);
            assertTrue(result.isExcluded(unit.getItems().get(0)));
            assertFalse(result.isExcluded(unit.getItems().get(1)));
        }

        @Test
        @DisplayName("目标语言内置类型无需声明")
        void testHostTypes() {
            assertNoErrors(analyze("Vec<String> names(void) { return @Vec.new(); }"));
        }
    }

    // ================================================================
    // 类型检查
    // ================================================================

    @Nested
    @DisplayName("类型检查")
    class TypeCheckTests {

        @Test
        @DisplayName("返回值类型不匹配")
        void testReturnMismatch() {
            assertError(analyze("int f(void) { return true; }"), SemanticError.ErrorKind.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("经过别名的参数不匹配")
        void testArgumentMismatch() {
            AnalysisResult result = analyze("typedef int Meters; void g(Meters m) {} void f(void) { g(false); }");
            assertError(result, SemanticError.ErrorKind.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("参数个数不匹配")
        void testArity() {
            assertError(analyze("void g(int a) {} void f(void) { g(1, 2); }"), SemanticError.ErrorKind.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("数字字面量可赋给任意数值类型")
        void testUntypedLiterals() {
            assertNoErrors(analyze("void f(void) { i64 a = 1; f32 b = 2.5; u64 c = 3; float d = -1; }"));
        }

        @Test
        @DisplayName("条件必须是 bool")
        void testCondition() {
            assertError(analyze("void f(int x) { if (x) { } }"), SemanticError.ErrorKind.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("未定义变量")
        void testUndefinedVariable() {
            assertError(analyze("int f(void) { return missing; }"), SemanticError.ErrorKind.UNDEFINED_VARIABLE);
        }

        @Test
        @DisplayName("给不可变绑定赋值")
        void testImmutableAssignment() {
            assertError(analyze("void f(void) { int x = 1; x = 2; }"), SemanticError.ErrorKind.INVALID_OPERATION);
            assertNoErrors(analyze("void f(void) { var int x = 1; x = 2; ++x; }"));
        }

        @Test
        @DisplayName("错误累积而非在第一个错误处停止")
        void testAccumulation() {
            AnalysisResult result = analyze("int f(void) { return true; } Missing g(void) { return 1; }"
                    + " void h(void) { return nope; }");
            assertTrue(result.getErrors().size() >= 3, result.getErrors().toString());
        }

        @Test
        @DisplayName("结构体字段访问与初始化")
        void testStructFields() {
            assertNoErrors(analyze("struct P { int x; int y; } int f(void) { P p = { .x = 1, .y = 2 }; return p.x; }"));
            assertError(analyze("struct P { int x; } int f(P p) { return p.z; }"),
                    SemanticError.ErrorKind.INVALID_OPERATION);
        }

        @Test
        @DisplayName("break 必须在循环内，标签必须存在")
        void testJumps() {
            assertError(analyze("void f(void) { break; }"), SemanticError.ErrorKind.INVALID_OPERATION);
            assertError(analyze("void f(void) { loop { break .nope; } }"), SemanticError.ErrorKind.INVALID_OPERATION);
            assertNoErrors(analyze("void f(void) { .outer: loop { while (true) { break .outer; } } }"));
        }

        @Test
        @DisplayName("? 需要可失败的返回类型")
        void testPropagation() {
            assertError(analyze("int? parse(int x) { return x; } int f(void) { return parse(1)?; }"),
                    SemanticError.ErrorKind.INVALID_OPERATION);
            assertNoErrors(analyze("int? parse(int x) { return x; } int? f(void) { return parse(1)?; }"));
        }

        @Test
        @DisplayName("分析器实例只能使用一次")
        void testSingleUse() {
            SemanticAnalyzer analyzer = new SemanticAnalyzer();
            analyzer.analyze(parse("int f(void) { return 1; }"));
            assertThrows(IllegalStateException.class, () -> analyzer.analyze(parse("int g(void) { return 1; }")));
        }
    }

    // ================================================================
    // 嵌套函数捕获
    // ================================================================

    @Nested
    @DisplayName("嵌套函数捕获")
    class CaptureTests {

        @Test
        @DisplayName("只读取外层变量为 READ_ONLY")
        void testReadOnly() {
            CompilationUnit unit = parse("int f(void) { int outer = 1; int get() { return outer; } return get(); }");
            AnalysisResult result = analyze(unit);
            assertNoErrors(result);
            CaptureInfo info = captures(unit, "f", "get");
            assertEquals(CaptureMode.READ_ONLY, info.getMode("outer"));
            assertEquals(ClosureKind.FN, info.getClosureKind());
        }

        @Test
        @DisplayName("赋值外层变量为 MUTABLE")
        void testMutable() {
            CompilationUnit unit = parse("void f(void) { var int count = 0; void bump() { count = count + 1; } bump(); }");
            assertNoErrors(analyze(unit));
            CaptureInfo info = captures(unit, "f", "bump");
            assertEquals(CaptureMode.MUTABLE, info.getMode("count"));
            assertEquals(ClosureKind.FN_MUT, info.getClosureKind());
        }

        @Test
        @DisplayName("按值传出且之后不再读取为 MOVE")
        void testMove() {
            CompilationUnit unit = parse("void consume(String s) {} "
                    + "void f(String name) { void take() { consume(name); } take(); }");
            assertNoErrors(analyze(unit));
            CaptureInfo info = captures(unit, "f", "take");
            assertEquals(CaptureMode.MOVE, info.getMode("name"));
            assertEquals(ClosureKind.FN_ONCE, info.getClosureKind());
            assertNull(info.getMode("consume"));
        }

        @Test
        @DisplayName("之后仍被读取时不是 MOVE")
        void testMoveReadAfter() {
            CompilationUnit unit = parse("void consume(String s) {} "
                    + "void f(String name) { void take() { consume(name); } take(); consume(name); }");
            assertNoErrors(analyze(unit));
            assertEquals(CaptureMode.READ_ONLY, captures(unit, "f", "take").getMode("name"));
        }

        @Test
        @DisplayName("既赋值又按值传出时 MUTABLE 优先")
        void testMutableWinsOverMove() {
            CompilationUnit unit = parse("void consume(String s) {} "
                    + "void f(void) { var String name = @String.new(); "
                    + "void take() { consume(name); name = @String.new(); } take(); }");
            assertNoErrors(analyze(unit));
            assertEquals(CaptureMode.MUTABLE, captures(unit, "f", "take").getMode("name"));
        }

        @Test
        @DisplayName("引用之后才声明的变量是捕获违规")
        void testForwardReference() {
            AnalysisResult result = analyze("void f(void) { int peek() { return later; } int later = 2; }");
            assertError(result, SemanticError.ErrorKind.CAPTURE_VIOLATION);
            assertFalse(result.hasError(SemanticError.ErrorKind.UNDEFINED_VARIABLE));
        }

        @Test
        @DisplayName("捕获违规只在该嵌套函数体内抑制未定义报告")
        void testForwardReferenceSuppressionScoped() {
            AnalysisResult result = analyze("void f(void) { int h() { return y; } int y = 1; }\n"
                    + "int g(void) { return y; }");
            assertError(result, SemanticError.ErrorKind.CAPTURE_VIOLATION);
            long undefined = result.getErrors().stream()
                    .filter(e -> e.getKind() == SemanticError.ErrorKind.UNDEFINED_VARIABLE)
                    .count();
            assertEquals(1, undefined);
        }

        @Test
        @DisplayName("之后的内层块中的声明不算前向引用")
        void testLaterInnerBlockDeclaration() {
            AnalysisResult result = analyze("void f(void) { int h() { return y; } { int y = 1; } }");
            assertError(result, SemanticError.ErrorKind.UNDEFINED_VARIABLE);
            assertFalse(result.hasError(SemanticError.ErrorKind.CAPTURE_VIOLATION));
        }

        @Test
        @DisplayName("之后的循环体中的声明不算前向引用")
        void testLaterLoopBodyDeclaration() {
            AnalysisResult result = analyze("void f(bool c) { int h() { return y; } while (c) { int y = 1; } }");
            assertError(result, SemanticError.ErrorKind.UNDEFINED_VARIABLE);
            assertFalse(result.hasError(SemanticError.ErrorKind.CAPTURE_VIOLATION));
        }

        @Test
        @DisplayName("嵌套函数内不能再嵌套函数")
        void testSingleLevelNesting() {
            AnalysisResult result = analyze("void f(void) { void g() { void h() { } } }");
            assertError(result, SemanticError.ErrorKind.CAPTURE_VIOLATION);
        }

        @Test
        @DisplayName("嵌套函数不能声明为 static")
        void testStaticNested() {
            assertError(analyze("void f(void) { static void g() { } }"), SemanticError.ErrorKind.VISIBILITY_ERROR);
        }

        @Test
        @DisplayName("嵌套函数自己的参数与局部变量不算捕获")
        void testOwnBindings() {
            CompilationUnit unit = parse("void f(void) { int base = 1; int add(int a) { int b = a; return b + base; } }");
            assertNoErrors(analyze(unit));
            CaptureInfo info = captures(unit, "f", "add");
            assertEquals(1, info.getCaptures().size());
            assertEquals(CaptureMode.READ_ONLY, info.getMode("base"));
        }
    }
}
