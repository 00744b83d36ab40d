package com.raditha.metaast.model;

import java.util.List;

/**
 * Compound assignment such as {@code x += 1}.
 */
public record AugmentedAssignment(String operator, MetaNode target, MetaNode value, NodeMeta meta)
        implements MetaNode {

    public AugmentedAssignment {
        meta = NodeMeta.orEmpty(meta);
    }

    public AugmentedAssignment(String operator, MetaNode target, MetaNode value) {
        this(operator, target, value, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.AUGMENTED_ASSIGNMENT;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(target, value);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAugmentedAssignment(this);
    }
}
