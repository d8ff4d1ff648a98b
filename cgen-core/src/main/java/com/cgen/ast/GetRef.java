package com.cgen.ast;

import java.util.Collections;
import java.util.List;

/**
 * 取地址 {@code (&x)}
 */
public final class GetRef extends Node {
    private final Node inner;

    public GetRef(Node inner) {
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
        return visitor.visitGetRef(this, context);
    }
}
