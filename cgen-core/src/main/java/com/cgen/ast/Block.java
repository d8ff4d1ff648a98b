package com.cgen.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 代码块
 */
public final class Block extends Node {
    private final List<Node> statements;

    public Block() {
        this.statements = new ArrayList<>();
    }

    public Block(List<? extends Node> statements) {
        this.statements = new ArrayList<>(checkChildren(statements, "statements"));
        claim(this.statements);
    }

    /**
     * 追加语句，接管其所有权
     */
    public Block push(Node statement) {
        statements.add(adoptLater(statement, "statements"));
        return this;
    }

    public List<Node> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public List<Node> getChildren() {
        return getStatements();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
