package com.crustylang.cli;

import org.junit.jupiter.api.DisplayName;
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

@DisplayName("fmt 子命令测试")
class FmtCommandTest {

    private static final String UNFORMATTED = "int f(int x){int y=x;return y;}";
    private static final String FORMATTED = "int f(int x) {\n    let y: int = x;\n    return y;\n}\n";

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

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("main.crst");
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("格式化并写回文件")
    void testFormatInPlace() throws IOException {
        Path file = write(UNFORMATTED);
        assertThat(run("fmt", file.toString())).isEqualTo(0);
        assertThat(read(file)).isEqualTo(FORMATTED);
        assertThat(out.toString()).contains("已格式化: ");
    }

    @Test
    @DisplayName("--check 发现未格式化文件时退出码 1 且不修改文件")
    void testCheckUnformatted() throws IOException {
        Path file = write(UNFORMATTED);
        assertThat(run("fmt", "--check", file.toString())).isEqualTo(1);
        assertThat(read(file)).isEqualTo(UNFORMATTED);
        assertThat(out.toString()).contains("需要格式化: ");
    }

    @Test
    @DisplayName("--check 对已格式化文件返回 0")
    void testCheckFormatted() throws IOException {
        Path file = write(FORMATTED);
        assertThat(run("fmt", "--check", file.toString())).isEqualTo(0);
        assertThat(out.toString()).contains("格式正确: ");
    }

    @Test
    @DisplayName("Tab 缩进")
    void testUseTabs() throws IOException {
        Path file = write(UNFORMATTED);
        assertThat(run("fmt", "--use-tabs", file.toString())).isEqualTo(0);
        assertThat(read(file)).isEqualTo("int f(int x) {\n\tlet y: int = x;\n\treturn y;\n}\n");
    }

    @Test
    @DisplayName("语法错误时报告诊断且不写回")
    void testSyntaxError() throws IOException {
        Path file = write("int f( {");
        assertThat(run("fmt", file.toString())).isEqualTo(1);
        assertThat(read(file)).isEqualTo("int f( {");
        assertThat(err.toString()).contains("error[SYNTAX_ERROR]");
    }

    @Test
    @DisplayName("负缩进宽度属于用法错误")
    void testNegativeIndent() throws IOException {
        Path file = write(UNFORMATTED);
        assertThat(run("fmt", "--indent-size", "-2", file.toString())).isEqualTo(2);
    }
}
