package com.cgen.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数定义
 */
public final class Function extends Node {
    private final String name;
    private final List<Node> parameters;
    private final Node returnType;
    private final Block body;

    public Function(String name, Node returnType, List<? extends Node> parameters, Block body) {
        this.name = checkName(name);
        this.returnType = checkChild(returnType, "returnType");
        this.parameters = checkChildren(parameters, "parameters");
        this.body = checkChild(body, "body");

        List<Node> owned = new ArrayList<>(this.parameters);
        owned.add(returnType);
        owned.add(body);
        claim(owned);
    }

    public String getName() {
        return name;
    }

    public List<Node> getParameters() {
        return parameters;
    }

    public Node getReturnType() {
        return returnType;
    }

    /** 函数体，可继续 push 语句 */
    public Block getBody() {
        return body;
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>(parameters.size() + 2);
        children.add(returnType);
        children.addAll(parameters);
        children.add(body);
        return Collections.unmodifiableList(children);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunction(this, context);
    }
}
