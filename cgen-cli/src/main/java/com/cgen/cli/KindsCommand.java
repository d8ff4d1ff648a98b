package com.cgen.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * picocli kinds 子命令：列出 JSON 格式支持的节点种类
 */
@Command(name = "kinds", description = "列出 JSON 语法树支持的节点种类")
public class KindsCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        PrintWriter out = spec.commandLine().getOut();
        for (String kind : TreeReader.KINDS) {
            out.println(kind);
        }
        out.flush();
    }
}
