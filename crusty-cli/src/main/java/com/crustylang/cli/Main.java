package com.crustylang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.concurrent.Callable;

/**
 * crustyc CLI 入口点（picocli）
 */
@Command(name = "crustyc", version = "crustyc 0.1.0",
         mixinStandardHelpOptions = true,
         description = "将 Crusty 源码转译为 Rust",
         subcommands = {FmtCommand.class, BuildCommand.class})
public class Main implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "源码文件（.crst）")
    String file;

    @Option(names = {"-o", "--output"}, description = "输出文件（默认输出到标准输出）")
    String output;

    @Option(names = "--emit", defaultValue = "rust", description = "输出形式（rust, ast, crusty）")
    String emit;

    @Option(names = "--diagnostics", defaultValue = "text", description = "诊断格式（text, json）")
    String diagnostics;

    @Option(names = {"-v", "--verbose"}, description = "输出各阶段进度")
    boolean verbose;

    @Override
    public Integer call() {
        CommandLine cmd = spec.commandLine();
        if (file == null) {
            cmd.usage(cmd.getErr());
            return CompileRunner.EXIT_USAGE;
        }
        CompileRunner runner = new CompileRunner(cmd.getOut(), cmd.getErr(), verbose);
        return runner.compileFile(file, output, emit, diagnostics);
    }

    /**
     * 创建命令行实例（main 与测试共用）
     */
    static CommandLine newCommandLine() {
        return new CommandLine(new Main());
    }

    public static void main(String[] args) {
        // Windows 控制台可能仍用 GBK，使用 native.encoding 确保中文正确显示
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = newCommandLine();
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(newCommandLine().execute(args));
        }
    }

    /**
     * 获取控制台实际使用的字符编码名。native.encoding 属性反映操作系统原生编码。
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
