package com.raditha.metaast.model;

import java.util.List;

/**
 * A list literal.
 */
public record ListExpr(List<MetaNode> elements, NodeMeta meta) implements MetaNode {

    public ListExpr {
        elements = NodeLists.copy(elements);
        meta = NodeMeta.orEmpty(meta);
    }

    public ListExpr(List<MetaNode> elements) {
        this(elements, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST;
    }

    @Override
    public List<MetaNode> children() {
        return elements;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitList(this);
    }
}
