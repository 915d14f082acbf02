package com.crustylang.cli;

import com.crustylang.compiler.formatter.FormatConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * picocli fmt 子命令：格式化源码文件
 */
@Command(name = "fmt", description = "格式化源码文件")
public class FmtCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    @Option(names = "--indent-size", defaultValue = "4", description = "缩进空格数（默认 4）")
    int indentSize;

    @Option(names = "--use-tabs", description = "使用 Tab 缩进")
    boolean useTabs;

    @Option(names = "--check", description = "只检查是否已格式化，不写回文件")
    boolean check;

    @Override
    public Integer call() {
        CommandLine cmd = spec.commandLine();
        if (indentSize < 0) {
            cmd.getErr().println("错误: 缩进空格数不能为负数 - " + indentSize);
            return CompileRunner.EXIT_USAGE;
        }
        FormatConfig config = new FormatConfig(indentSize, !useTabs);
        return new CompileRunner(cmd.getOut(), cmd.getErr(), false).formatFile(file, config, check);
    }
}
