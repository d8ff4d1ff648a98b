package com.cgen.ast;

import java.util.Collections;
import java.util.List;

/**
 * 变量声明（局部变量、参数、结构体字段）
 */
public final class DeclLocal extends Node {
    private final String name;
    private final Node type;

    public DeclLocal(String name, Node type) {
        this.name = checkName(name);
        this.type = checkChild(type, "type");
        claim(type);
    }

    public String getName() {
        return name;
    }

    public Node getType() {
        return type;
    }

    @Override
    public List<Node> getChildren() {
        return Collections.singletonList(type);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDeclLocal(this, context);
    }
}
