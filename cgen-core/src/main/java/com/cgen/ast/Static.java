package com.cgen.ast;

import java.util.Collections;
import java.util.List;

/**
 * static 存储修饰，通常包裹 {@link DeclLocal}
 */
public final class Static extends Node {
    private final Node inner;

    public Static(Node inner) {
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
        return visitor.visitStatic(this, context);
    }
}
