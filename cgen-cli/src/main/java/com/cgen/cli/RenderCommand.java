package com.cgen.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;
import java.util.logging.Level;

/**
 * picocli render 子命令：把 JSON 语法树渲染为 C 风格源码
 */
@Command(name = "render", description = "把 JSON 描述的语法树渲染为 C 风格源码")
public class RenderCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "语法树 JSON 文件（- 表示标准输入）")
    String file;

    @Option(names = {"-o", "--output"}, description = "输出文件（默认标准输出）")
    String output;

    @Option(names = "--newline", description = "在输出末尾追加换行")
    boolean newline;

    @Option(names = {"-v", "--verbose"}, description = "输出调试日志")
    boolean verbose;

    @Override
    public Integer call() {
        if (verbose) {
            Main.configureLogging(Level.FINE);
        }
        CommandLine cmd = spec.commandLine();
        return new RenderRunner(System.in, cmd.getOut(), cmd.getErr()).render(file, output, newline);
    }
}
