package com.cgen.ast;

import java.util.Collections;
import java.util.List;

/**
 * 对已声明名称的引用
 */
public final class Local extends Node {
    private final String name;

    public Local(String name) {
        this.name = checkName(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public List<Node> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLocal(this, context);
    }
}
