package com.cgen.ast;

import java.util.Collections;
import java.util.List;

/**
 * 具名（结构体）类型引用，如 struct Point
 */
public final class Type extends Node {
    private final String name;

    public Type(String name) {
        this.name = checkName(name);
    }

    public String getName() {
        return name;
    }

    /**
     * 以当前类型为元素构造指针类型，当前节点不能已有父节点
     */
    public PointerOf pointerOf() {
        return new PointerOf(this);
    }

    public ArrayOf arrayOf() {
        return new ArrayOf(this, 0);
    }

    public ArrayOf arrayOf(long size) {
        return new ArrayOf(this, size);
    }

    @Override
    public List<Node> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitType(this, context);
    }
}
