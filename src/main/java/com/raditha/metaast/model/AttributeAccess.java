package com.raditha.metaast.model;

import java.util.List;

/**
 * Access of a named attribute on a receiver, e.g. {@code user.name}.
 */
public record AttributeAccess(MetaNode receiver, String attribute, NodeMeta meta) implements MetaNode {

    public AttributeAccess {
        meta = NodeMeta.orEmpty(meta);
    }

    public AttributeAccess(MetaNode receiver, String attribute) {
        this(receiver, attribute, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ATTRIBUTE_ACCESS;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(receiver);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAttributeAccess(this);
    }
}
