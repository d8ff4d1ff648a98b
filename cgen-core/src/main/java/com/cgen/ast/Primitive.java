package com.cgen.ast;

import java.util.Collections;
import java.util.List;

/**
 * 内建标量类型
 */
public final class Primitive extends Node {
    private final Kind kind;

    public Primitive(Kind kind) {
        if (kind == null) {
            throw new IncompleteNodeException("Primitive", "kind");
        }
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public List<Node> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPrimitive(this, context);
    }

    /**
     * 标量种类
     */
    public enum Kind {
        I8,
        I16,
        I32,
        I64,
        U8,
        U16,
        U32,
        U64,
        F32,
        F64
    }
}
