package com.cgen.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序根节点：顶层声明序列
 */
public final class Program extends Node {
    private final List<Node> declarations;

    public Program() {
        this.declarations = new ArrayList<>();
    }

    public Program(List<? extends Node> declarations) {
        this.declarations = new ArrayList<>(checkChildren(declarations, "declarations"));
        claim(this.declarations);
    }

    /**
     * 追加顶层声明，接管其所有权
     */
    public Program push(Node declaration) {
        declarations.add(adoptLater(declaration, "declarations"));
        return this;
    }

    public List<Node> getDeclarations() {
        return Collections.unmodifiableList(declarations);
    }

    @Override
    public List<Node> getChildren() {
        return getDeclarations();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
