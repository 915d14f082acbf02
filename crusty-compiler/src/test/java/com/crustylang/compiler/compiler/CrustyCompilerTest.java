package com.crustylang.compiler.compiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 编译器门面测试：各阶段诊断与输出形式
 */
class CrustyCompilerTest {

    private final CrustyCompiler compiler = new CrustyCompiler();

    private CompilerOptions quietOptions() {
        return new CompilerOptions()
                .setUnitName("main.crst")
                .setErrStream(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("成功转译")
    class SuccessTests {

        @Test
        @DisplayName("别名链转译为 Rust")
        void testTranspile() {
            CompilationResult result = compiler.compile("typedef int A; typedef A B; int f(B x) { return x; }",
                    "main.crst");
            assertTrue(result.isSuccess());
            assertTrue(result.getDiagnostics().isEmpty());
            assertTrue(result.getOutput().endsWith("pub fn f(x: i32) -> i32 {\n    return x;\n}\n"),
                    result.getOutput());
        }

        @Test
        @DisplayName("--emit ast 输出解析后的类型")
        void testEmitAst() {
            CompilationResult result = compiler.compile("typedef int A; A f(A x) { return x; }",
                    quietOptions().setEmitMode(CompilerOptions.EmitMode.AST));
            assertTrue(result.isSuccess());
            String dump = result.getOutput();
            assertTrue(dump.startsWith("CompilationUnit"), dump);
            assertTrue(dump.contains("FunctionDecl f -> A (int)"), dump);
            assertTrue(dump.contains("Parameter x: A (int)"), dump);
        }

        @Test
        @DisplayName("--emit crusty 不做语义检查")
        void testEmitCrusty() {
            CompilationResult result = compiler.compile("int f() { return undefinedName; }",
                    quietOptions().setEmitMode(CompilerOptions.EmitMode.CRUSTY));
            assertTrue(result.isSuccess());
            assertEquals("int f() {\n    return undefinedName;\n}\n", result.getOutput());
        }

        @Test
        @DisplayName("缩进配置传给代码生成")
        void testIndentConfig() {
            CompilerOptions options = quietOptions();
            options.getFormatConfig().setIndentSize(2);
            CompilationResult result = compiler.compile("int f(int x) { return x; }", options);
            assertEquals("pub fn f(x: i32) -> i32 {\n  return x;\n}\n", result.getOutput());
        }
    }

    @Nested
    @DisplayName("诊断")
    class DiagnosticTests {

        @Test
        @DisplayName("循环别名只报告诊断，不输出代码")
        void testCycleHasNoOutput() {
            CompilationResult result = compiler.compile("typedef int A; typedef A A;", quietOptions());
            assertFalse(result.isSuccess());
            assertNull(result.getOutput());
            List<Diagnostic> diagnostics = result.getDiagnostics();
            assertEquals(1, diagnostics.size());
            Diagnostic d = diagnostics.get(0);
            assertEquals(Diagnostic.Stage.SEMANTIC, d.getStage());
            assertEquals("CIRCULAR_TYPE_ALIAS", d.getKind());
            assertEquals(1, d.getLine());
        }

        @Test
        @DisplayName("语法错误带位置与期望 token")
        void testSyntaxError() {
            CompilationResult result = compiler.compile("int f() {\n  return 1\n}", quietOptions());
            assertFalse(result.isSuccess());
            Diagnostic d = result.getDiagnostics().get(0);
            assertEquals(Diagnostic.Stage.SYNTAX, d.getStage());
            assertEquals("SYNTAX_ERROR", d.getKind());
            assertEquals(3, d.getLine());
            assertEquals(1, d.getColumn());
            assertTrue(d.getMessage().contains("SEMICOLON"), d.getMessage());
        }

        @Test
        @DisplayName("词法错误归入词法阶段")
        void testLexicalError() {
            CompilationResult result = compiler.compile("int f() { return \"abc; }", quietOptions());
            assertFalse(result.isSuccess());
            Diagnostic d = result.getDiagnostics().get(0);
            assertEquals(Diagnostic.Stage.LEXICAL, d.getStage());
            assertEquals("LEXICAL_ERROR", d.getKind());
        }

        @Test
        @DisplayName("语义错误全部收集")
        void testSemanticErrorsAccumulate() {
            CompilationResult result = compiler.compile(
                    "int f(void) { return missing; }\nbool g(void) { return 1.5; }\nvoid h(void) { break; }",
                    quietOptions());
            assertFalse(result.isSuccess());
            assertEquals(3, result.getDiagnostics().size(), result.getDiagnostics().toString());
            for (Diagnostic d : result.getDiagnostics()) {
                assertEquals(Diagnostic.Stage.SEMANTIC, d.getStage());
            }
        }
    }

    @Test
    @DisplayName("同一实例多次编译互不影响")
    void testCompilerReuse() {
        CompilationResult bad = compiler.compile("typedef int A; typedef A A;", quietOptions());
        CompilationResult good = compiler.compile("typedef int A; A f(void) { return 1; }", quietOptions());
        assertFalse(bad.isSuccess());
        assertTrue(good.isSuccess(), good.getDiagnostics().toString());
    }
}
