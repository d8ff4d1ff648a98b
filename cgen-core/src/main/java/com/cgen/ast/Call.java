package com.cgen.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 调用表达式
 */
public final class Call extends Node {
    private final Node callee;
    private final List<Node> arguments;

    public Call(Node callee, List<? extends Node> arguments) {
        this.callee = checkChild(callee, "callee");
        this.arguments = checkChildren(arguments, "arguments");

        List<Node> owned = new ArrayList<>(this.arguments);
        owned.add(callee);
        claim(owned);
    }

    public Node getCallee() {
        return callee;
    }

    public List<Node> getArguments() {
        return arguments;
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>(arguments.size() + 1);
        children.add(callee);
        children.addAll(arguments);
        return Collections.unmodifiableList(children);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }
}
