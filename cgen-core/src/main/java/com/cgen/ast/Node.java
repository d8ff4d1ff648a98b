package com.cgen.ast;

import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * AST 节点基类
 *
 * <p>变体集合是封闭的：构造器仅包内可见，全部变体定义在 {@code com.cgen.ast} 中，
 * 因此 {@link AstVisitor} 可以对所有变体穷举。</p>
 *
 * <p>每个节点独占其子节点。节点不保存父节点引用，只记录自己是否已被挂到某个父节点下，
 * 同一节点挂到第二个父节点时抛出 {@link NodeOwnershipException}。</p>
 */
public abstract class Node {
    private boolean attached;

    Node() {
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);

    /**
     * 直接子节点（按输出顺序）
     */
    public abstract List<Node> getChildren();

    /**
     * 以指定变体查看当前节点，变体不匹配时返回空
     */
    public <T extends Node> Optional<T> as(Class<T> variant) {
        if (variant.isInstance(this)) {
            return Optional.of(variant.cast(this));
        }
        return Optional.empty();
    }

    public boolean is(Class<? extends Node> variant) {
        return variant.isInstance(this);
    }

    /** 是否已挂到某个父节点下 */
    public boolean isAttached() {
        return attached;
    }

    public String getVariantName() {
        return getClass().getSimpleName();
    }

    // ============ 所有权 ============

    /**
     * 校验子节点可挂入指定槽位（不修改任何状态）
     */
    final <T extends Node> T checkChild(T child, String slot) {
        if (child == null) {
            throw new IncompleteNodeException(getVariantName(), slot);
        }
        if (child == this) {
            throw new NodeOwnershipException(child.getVariantName(),
                    getVariantName() + "." + slot, "a node cannot own itself");
        }
        // 私有成员不能经由类型变量访问
        Node node = child;
        if (node.attached) {
            throw new NodeOwnershipException(node.getVariantName(),
                    getVariantName() + "." + slot, "node already has a parent");
        }
        return child;
    }

    final String checkName(String name) {
        if (name == null) {
            throw new IncompleteNodeException(getVariantName(), "name");
        }
        return name;
    }

    /**
     * 检查列表中每个元素后复制为不可变列表
     */
    final List<Node> checkChildren(List<? extends Node> children, String slot) {
        if (children == null) {
            throw new IncompleteNodeException(getVariantName(), slot);
        }
        Node[] copy = children.toArray(new Node[0]);
        for (Node child : copy) {
            checkChild(child, slot);
        }
        return Collections.unmodifiableList(Arrays.asList(copy));
    }

    /**
     * 接管已校验的子节点。同一实例在参数中出现两次视为共享子树。
     */
    final void claim(List<? extends Node> children) {
        Map<Node, Boolean> seen = new IdentityHashMap<>();
        for (Node child : children) {
            if (seen.put(child, Boolean.TRUE) != null) {
                throw new NodeOwnershipException(child.getVariantName(), getVariantName(),
                        "the same node is passed twice");
            }
        }
        for (Node child : children) {
            child.attached = true;
        }
    }

    final void claim(Node... children) {
        claim(Arrays.asList(children));
    }

    /**
     * 向已存在的节点追加子节点，拒绝会形成环的追加
     */
    final <T extends Node> T adoptLater(T child, String slot) {
        Node node = checkChild(child, slot);
        if (node.contains(this)) {
            throw new NodeOwnershipException(node.getVariantName(),
                    getVariantName() + "." + slot, "attaching would create a cycle");
        }
        node.attached = true;
        return child;
    }

    private boolean contains(Node target) {
        if (this == target) {
            return true;
        }
        for (Node child : getChildren()) {
            if (child.contains(target)) {
                return true;
            }
        }
        return false;
    }
}
