package com.cgen.ast;

import java.util.List;

/**
 * 结构体定义
 */
public final class DeclType extends Node {
    private final String name;
    private final List<Node> fields;

    public DeclType(String name, List<? extends Node> fields) {
        this.name = checkName(name);
        this.fields = checkChildren(fields, "fields");
        claim(this.fields);
    }

    public String getName() {
        return name;
    }

    public List<Node> getFields() {
        return fields;
    }

    @Override
    public List<Node> getChildren() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDeclType(this, context);
    }
}
