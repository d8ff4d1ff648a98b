package com.cgen.cli;

/**
 * JSON 语法树描述不合法
 */
public class TreeFormatException extends RuntimeException {
    private final String path;

    public TreeFormatException(String path, String message) {
        super(message);
        this.path = path;
    }

    public TreeFormatException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /** 出错元素的 JSON 路径，如 $.body.statements[1] */
    public String getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " at " + path;
    }
}
