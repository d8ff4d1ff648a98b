package com.cgen.ast;

/**
 * 节点缺少必需的子节点或名称
 */
public class IncompleteNodeException extends RuntimeException {
    private final String variant;
    private final String slot;

    public IncompleteNodeException(String variant, String slot) {
        super("incomplete node");
        this.variant = variant;
        this.slot = slot;
    }

    public String getVariant() {
        return variant;
    }

    public String getSlot() {
        return slot;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + ": " + variant + "." + slot + " is required";
    }
}
