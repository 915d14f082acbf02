package com.crustylang.cli;

import com.crustylang.compiler.codegen.InternalCodegenError;
import com.crustylang.compiler.compiler.CompilationResult;
import com.crustylang.compiler.compiler.CompilerOptions;
import com.crustylang.compiler.compiler.CrustyCompiler;
import com.crustylang.compiler.formatter.FormatConfig;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 转译、构建、格式化执行器。返回值即进程退出码。
 */
public class CompileRunner {

    /** 成功 */
    static final int EXIT_OK = 0;
    /** 源码有错误 */
    static final int EXIT_COMPILE_ERROR = 1;
    /** I/O 或命令行用法错误 */
    static final int EXIT_USAGE = 2;

    private final CrustyCompiler compiler = new CrustyCompiler();
    private final PrintWriter out;
    private final PrintWriter err;
    private final boolean verbose;

    public CompileRunner(PrintWriter out, PrintWriter err, boolean verbose) {
        this.out = out;
        this.err = err;
        this.verbose = verbose;
    }

    /**
     * 转译单个文件，输出到文件或标准输出
     */
    public int compileFile(String filePath, String outputPath, String emit, String diagnosticFormat) {
        CompilerOptions.EmitMode mode = parseEmitMode(emit);
        if (mode == null) {
            err.println("错误: 未知输出形式 '" + emit + "'（可选: rust, ast, crusty）");
            return EXIT_USAGE;
        }
        DiagnosticReporter.Format format = DiagnosticReporter.parseFormat(diagnosticFormat);
        if (format == null) {
            err.println("错误: 未知诊断格式 '" + diagnosticFormat + "'（可选: text, json）");
            return EXIT_USAGE;
        }

        Path path = Paths.get(filePath);
        String source = readSource(path);
        if (source == null) {
            return EXIT_USAGE;
        }
        String unitName = path.getFileName().toString();

        if (verbose) {
            out.println("转译: " + filePath + "（输出形式: " + mode.name().toLowerCase() + "）");
        }
        CompilationResult result;
        try {
            result = compiler.compile(source, new CompilerOptions().setUnitName(unitName).setEmitMode(mode));
        } catch (InternalCodegenError e) {
            err.println("内部错误: " + e.getMessage());
            return EXIT_COMPILE_ERROR;
        }

        if (!result.isSuccess()) {
            new DiagnosticReporter(format, out, err).report(unitName, result.getDiagnostics());
            return EXIT_COMPILE_ERROR;
        }

        if (outputPath == null) {
            out.print(result.getOutput());
            out.flush();
            return EXIT_OK;
        }
        try {
            Path target = Paths.get(outputPath);
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.write(target, result.getOutput().getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            err.println("错误: 无法写入文件 - " + outputPath + ": " + e.getMessage());
            return EXIT_USAGE;
        }
        if (verbose) {
            out.println("已生成: " + outputPath);
        }
        return EXIT_OK;
    }

    /**
     * 格式化文件；check 为 true 时只检查不写回
     */
    public int formatFile(String filePath, FormatConfig config, boolean check) {
        Path path = Paths.get(filePath);
        String source = readSource(path);
        if (source == null) {
            return EXIT_USAGE;
        }
        String unitName = path.getFileName().toString();

        CompilationResult result = compiler.compile(source, new CompilerOptions()
                .setUnitName(unitName)
                .setEmitMode(CompilerOptions.EmitMode.CRUSTY)
                .setFormatConfig(config));
        if (!result.isSuccess()) {
            new DiagnosticReporter(DiagnosticReporter.Format.TEXT, out, err).report(unitName, result.getDiagnostics());
            return EXIT_COMPILE_ERROR;
        }

        String formatted = result.getOutput();
        if (check) {
            if (!formatted.equals(source)) {
                out.println("需要格式化: " + filePath);
                return EXIT_COMPILE_ERROR;
            }
            out.println("格式正确: " + filePath);
            return EXIT_OK;
        }

        try {
            Files.write(path, formatted.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            err.println("错误: 无法写入文件 - " + filePath + ": " + e.getMessage());
            return EXIT_USAGE;
        }
        out.println("已格式化: " + filePath);
        return EXIT_OK;
    }

    /**
     * 构建目录（增量）
     */
    public int buildProject(String sourceDir, String outputDir, int threads) {
        try {
            IncrementalBuilder builder = new IncrementalBuilder(out, err, verbose);
            IncrementalBuilder.BuildSummary summary = builder.build(Paths.get(sourceDir), Paths.get(outputDir), threads);
            return summary.isSuccess() ? EXIT_OK : EXIT_COMPILE_ERROR;
        } catch (IOException e) {
            err.println("构建错误: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private String readSource(Path path) {
        if (!Files.isRegularFile(path)) {
            err.println("错误: 文件不存在 - " + path);
            return null;
        }
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + path + ": " + e.getMessage());
            return null;
        }
    }

    static CompilerOptions.EmitMode parseEmitMode(String value) {
        if (value == null) return CompilerOptions.EmitMode.RUST;
        switch (value.toLowerCase()) {
            case "rust":   return CompilerOptions.EmitMode.RUST;
            case "ast":    return CompilerOptions.EmitMode.AST;
            case "crusty": return CompilerOptions.EmitMode.CRUSTY;
            default:       return null;
        }
    }
}
