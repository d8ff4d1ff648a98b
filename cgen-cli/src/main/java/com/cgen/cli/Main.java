package com.cgen.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * cgen CLI 入口点（picocli）
 */
@Command(name = "cgen", version = "cgen v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {RenderCommand.class, KindsCommand.class})
public class Main implements Runnable {

    // 保持强引用，避免日志级别随 Logger 被回收而丢失
    private static final Logger CGEN_LOGGER = Logger.getLogger("com.cgen");

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // 未指定子命令时打印用法
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * 日志统一输出到 stderr，不干扰 stdout 上的生成代码
     */
    static void configureLogging(Level level) {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(level);
        rootLogger.addHandler(stderrHandler);
        CGEN_LOGGER.setLevel(level);
    }

    /**
     * 构造命令行，输出流固定按 UTF-8 编码，与 -o 写入的文件一致
     */
    static CommandLine newCommandLine(OutputStream out, OutputStream err) {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), true));
        cmd.setErr(new PrintWriter(new OutputStreamWriter(err, StandardCharsets.UTF_8), true));
        return cmd;
    }

    public static void main(String[] args) {
        configureLogging(Level.WARNING);
        int exitCode = newCommandLine(System.out, System.err).execute(args);
        System.exit(exitCode);
    }
}
