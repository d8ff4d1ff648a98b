package com.cgen.ast;

/**
 * 违反单一所有权：节点被挂到第二个父节点、挂到自身或形成环
 */
public class NodeOwnershipException extends RuntimeException {
    private final String variant;
    private final String target;

    public NodeOwnershipException(String variant, String target, String reason) {
        super(reason);
        this.variant = variant;
        this.target = target;
    }

    /** 被挂接节点的变体名 */
    public String getVariant() {
        return variant;
    }

    /** 目标位置（父节点变体名，可能带槽位） */
    public String getTarget() {
        return target;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + ": cannot attach " + variant + " to " + target;
    }
}
