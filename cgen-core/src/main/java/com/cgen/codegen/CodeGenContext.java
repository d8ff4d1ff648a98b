package com.cgen.codegen;

/**
 * 单次渲染的输出缓冲区，每次 {@link CodeGenerator#render} 调用独享一个实例
 */
public class CodeGenContext {
    private final StringBuilder output = new StringBuilder();

    public CodeGenContext append(String text) {
        output.append(text);
        return this;
    }

    public CodeGenContext append(char c) {
        output.append(c);
        return this;
    }

    public CodeGenContext append(long value) {
        output.append(value);
        return this;
    }

    public String getOutput() {
        return output.toString();
    }
}
