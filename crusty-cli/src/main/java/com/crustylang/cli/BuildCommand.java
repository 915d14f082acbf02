package com.crustylang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * picocli build 子命令：转译目录下的所有源文件（支持增量构建）
 */
@Command(name = "build", description = "转译目录下的所有源文件（支持增量构建）")
public class BuildCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", defaultValue = ".", description = "源码目录")
    String sourceDir;

    @Option(names = {"-o", "--output"}, defaultValue = "build/rust", description = "输出目录（默认 build/rust）")
    String outputDir;

    @Option(names = {"-j", "--threads"}, defaultValue = "1", description = "并行转译的线程数（默认 1）")
    int threads;

    @Option(names = {"-v", "--verbose"}, description = "输出每个文件的处理结果")
    boolean verbose;

    @Override
    public Integer call() {
        CommandLine cmd = spec.commandLine();
        if (threads < 1) {
            cmd.getErr().println("错误: 线程数必须大于 0 - " + threads);
            return CompileRunner.EXIT_USAGE;
        }
        return new CompileRunner(cmd.getOut(), cmd.getErr(), verbose).buildProject(sourceDir, outputDir, threads);
    }
}
