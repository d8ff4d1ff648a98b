package com.cgen.ast;

import java.util.Collections;
import java.util.List;

/**
 * 指针类型
 */
public final class PointerOf extends Node {
    private final Node inner;

    public PointerOf(Node inner) {
        this.inner = checkChild(inner, "inner");
        claim(inner);
    }

    public Node getInner() {
        return inner;
    }

    @Override
    public List<Node> getChildren() {
        return Collections.singletonList(inner);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPointerOf(this, context);
    }
}
