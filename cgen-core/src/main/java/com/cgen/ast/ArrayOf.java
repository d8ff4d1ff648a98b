package com.cgen.ast;

import java.util.Collections;
import java.util.List;

/**
 * 数组类型，size 为 0 表示未指定长度（如 char* argv[]）
 */
public final class ArrayOf extends Node {
    private final Node inner;
    private final long size;

    public ArrayOf(Node inner) {
        this(inner, 0);
    }

    public ArrayOf(Node inner, long size) {
        if (size < 0) {
            throw new IllegalArgumentException("array size must not be negative: " + size);
        }
        this.inner = checkChild(inner, "inner");
        this.size = size;
        claim(inner);
    }

    public Node getInner() {
        return inner;
    }

    public long getSize() {
        return size;
    }

    public boolean isSized() {
        return size > 0;
    }

    @Override
    public List<Node> getChildren() {
        return Collections.singletonList(inner);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayOf(this, context);
    }
}
