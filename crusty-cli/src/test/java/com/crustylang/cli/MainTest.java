package com.crustylang.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("crustyc 命令行测试")
class MainTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = Main.newCommandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Nested
    @DisplayName("转译")
    class TranspileTests {

        @Test
        @DisplayName("成功时输出 Rust 到标准输出，退出码 0")
        void testStdout() throws IOException {
            Path file = write("main.crst", "typedef int A; typedef A B; int f(B x) { return x; }");
            assertThat(run(file.toString())).isEqualTo(0);
            assertThat(out.toString()).endsWith("pub fn f(x: i32) -> i32 {\n    return x;\n}\n");
            assertThat(err.toString()).isEmpty();
        }

        @Test
        @DisplayName("-o 写入文件")
        void testOutputFile() throws IOException {
            Path file = write("main.crst", "int f(int x) { return x; }");
            Path target = tempDir.resolve("out").resolve("main.rs");
            assertThat(run(file.toString(), "-o", target.toString())).isEqualTo(0);
            assertThat(new String(Files.readAllBytes(target), StandardCharsets.UTF_8))
                    .isEqualTo("pub fn f(x: i32) -> i32 {\n    return x;\n}\n");
        }

        @Test
        @DisplayName("--emit crusty 输出规范格式源码")
        void testEmitCrusty() throws IOException {
            Path file = write("main.crst", "int f(int x){return x;}");
            assertThat(run(file.toString(), "--emit", "crusty")).isEqualTo(0);
            assertThat(out.toString()).isEqualTo("int f(int x) {\n    return x;\n}\n");
        }

        @Test
        @DisplayName("--emit ast 输出语法树")
        void testEmitAst() throws IOException {
            Path file = write("main.crst", "int f(int x) { return x; }");
            assertThat(run(file.toString(), "--emit", "ast")).isEqualTo(0);
            assertThat(out.toString()).startsWith("CompilationUnit").contains("FunctionDecl f");
        }
    }

    @Nested
    @DisplayName("诊断与退出码")
    class DiagnosticTests {

        @Test
        @DisplayName("文本诊断写到错误流，退出码 1")
        void testTextDiagnostics() throws IOException {
            Path file = write("cycle.crst", "typedef int A; typedef A A;");
            assertThat(run(file.toString())).isEqualTo(1);
            assertThat(out.toString()).isEmpty();
            assertThat(err.toString())
                    .contains("cycle.crst:1:")
                    .contains("error[CIRCULAR_TYPE_ALIAS]")
                    .contains("错误: cycle.crst 共 1 个错误");
        }

        @Test
        @DisplayName("JSON 诊断写到标准输出")
        void testJsonDiagnostics() throws IOException {
            Path file = write("bad.crst", "int f() {\n  return 1\n}");
            assertThat(run(file.toString(), "--diagnostics", "json")).isEqualTo(1);

            JsonObject root = JsonParser.parseString(out.toString()).getAsJsonObject();
            assertThat(root.get("file").getAsString()).isEqualTo("bad.crst");
            assertThat(root.get("success").getAsBoolean()).isFalse();
            JsonArray diagnostics = root.getAsJsonArray("diagnostics");
            assertThat(diagnostics.size()).isEqualTo(1);
            JsonObject diag = diagnostics.get(0).getAsJsonObject();
            assertThat(diag.get("stage").getAsString()).isEqualTo("syntax");
            assertThat(diag.get("kind").getAsString()).isEqualTo("SYNTAX_ERROR");
            assertThat(diag.get("line").getAsInt()).isEqualTo(3);
            assertThat(diag.get("column").getAsInt()).isEqualTo(1);
            assertThat(diag.get("message").getAsString()).contains("SEMICOLON");
        }

        @Test
        @DisplayName("文件不存在时退出码 2")
        void testMissingFile() {
            assertThat(run(tempDir.resolve("nope.crst").toString())).isEqualTo(2);
            assertThat(err.toString()).contains("文件不存在");
        }

        @Test
        @DisplayName("未知输出形式与缺少参数属于用法错误")
        void testUsageErrors() throws IOException {
            Path file = write("main.crst", "int f(int x) { return x; }");
            assertThat(run(file.toString(), "--emit", "wasm")).isEqualTo(2);
            assertThat(err.toString()).contains("未知输出形式");
            assertThat(run(file.toString(), "--diagnostics", "xml")).isEqualTo(2);
            assertThat(run()).isEqualTo(2);
        }
    }
}
