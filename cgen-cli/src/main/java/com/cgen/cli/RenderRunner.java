package com.cgen.cli;

import com.cgen.ast.IncompleteNodeException;
import com.cgen.ast.Node;
import com.cgen.ast.NodeOwnershipException;
import com.cgen.codegen.CodeGenerator;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 读取 JSON 语法树、生成代码并输出
 */
public class RenderRunner {

    private static final Logger LOG = Logger.getLogger(RenderRunner.class.getName());

    /** 从标准输入读取时使用的文件名 */
    public static final String STDIN = "-";

    private final InputStream stdin;
    private final PrintWriter out;
    private final PrintWriter err;

    public RenderRunner(InputStream stdin, PrintWriter out, PrintWriter err) {
        this.stdin = stdin;
        this.out = out;
        this.err = err;
    }

    /**
     * @return 进程退出码，0 表示成功
     */
    public int render(String input, String outputPath, boolean newline) {
        String json;
        try {
            json = readInput(input);
        } catch (IOException e) {
            return fail("cannot read " + input + ": " + e.getMessage(), e);
        }

        String code;
        try {
            Node root = new TreeReader().read(json);
            code = new CodeGenerator().render(root);
        } catch (TreeFormatException | IncompleteNodeException | NodeOwnershipException e) {
            return fail(e.getMessage(), e);
        }
        if (newline) {
            code = code + System.lineSeparator();
        }
        LOG.fine("rendered " + code.length() + " characters from " + input);

        if (outputPath == null) {
            out.print(code);
            out.flush();
            return 0;
        }
        try {
            Files.write(Paths.get(outputPath), code.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            return fail("cannot write " + outputPath + ": " + e.getMessage(), e);
        }
        LOG.fine("wrote " + outputPath);
        return 0;
    }

    private String readInput(String input) throws IOException {
        if (STDIN.equals(input)) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        Path path = Paths.get(input);
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    private int fail(String message, Exception cause) {
        LOG.log(Level.WARNING, message, cause);
        err.println("error: " + message);
        err.flush();
        return 1;
    }
}
