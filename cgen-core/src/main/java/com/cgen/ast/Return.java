package com.cgen.ast;

import java.util.Collections;
import java.util.List;

/**
 * Return 语句
 */
public final class Return extends Node {
    private final Node value;

    public Return(Node value) {
        this.value = checkChild(value, "value");
        claim(value);
    }

    public Node getValue() {
        return value;
    }

    @Override
    public List<Node> getChildren() {
        return Collections.singletonList(value);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitReturn(this, context);
    }
}
