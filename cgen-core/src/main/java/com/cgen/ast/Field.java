package com.cgen.ast;

import java.util.Collections;
import java.util.List;

/**
 * 字段访问 owner.name
 */
public final class Field extends Node {
    private final Node owner;
    private final String name;

    public Field(Node owner, String name) {
        this.owner = checkChild(owner, "owner");
        this.name = checkName(name);
        claim(owner);
    }

    public Node getOwner() {
        return owner;
    }

    public String getName() {
        return name;
    }

    @Override
    public List<Node> getChildren() {
        return Collections.singletonList(owner);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitField(this, context);
    }
}
