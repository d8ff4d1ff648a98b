package com.cgen.ast;

import java.util.Collections;
import java.util.List;

/**
 * 字面量表达式
 */
public final class Literal extends Node {
    private final Object value;
    private final Kind kind;

    public Literal(Object value, Kind kind) {
        if (value == null) {
            throw new IncompleteNodeException("Literal", "value");
        }
        if (kind == null) {
            throw new IncompleteNodeException("Literal", "kind");
        }
        if (!kind.getValueType().isInstance(value)) {
            throw new IllegalArgumentException("literal kind " + kind + " expects "
                    + kind.getValueType().getSimpleName() + " but got " + value.getClass().getSimpleName());
        }
        this.value = value;
        this.kind = kind;
    }

    public Object getValue() {
        return value;
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
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型及其 Java 载荷类型
     */
    public enum Kind {
        INT(Integer.class),
        LONG(Long.class),
        /** 无符号 64 位，载荷按二进制补码解释 */
        ULONG(Long.class),
        FLOAT(Float.class),
        DOUBLE(Double.class),
        CHAR(Character.class),
        STRING(String.class);

        private final Class<?> valueType;

        Kind(Class<?> valueType) {
            this.valueType = valueType;
        }

        public Class<?> getValueType() {
            return valueType;
        }
    }
}
