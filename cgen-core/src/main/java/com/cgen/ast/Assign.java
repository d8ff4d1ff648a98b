package com.cgen.ast;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 赋值表达式
 */
public final class Assign extends Node {
    private final Node lhs;
    private final Node rhs;

    public Assign(Node lhs, Node rhs) {
        this.lhs = checkChild(lhs, "lhs");
        this.rhs = checkChild(rhs, "rhs");
        claim(lhs, rhs);
    }

    public Node getLhs() {
        return lhs;
    }

    public Node getRhs() {
        return rhs;
    }

    @Override
    public List<Node> getChildren() {
        return Collections.unmodifiableList(Arrays.asList(lhs, rhs));
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssign(this, context);
    }
}
