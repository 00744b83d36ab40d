package com.raditha.metaast.model;

import java.util.List;

/**
 * A fixed-size tuple.
 */
public record TupleExpr(List<MetaNode> elements, NodeMeta meta) implements MetaNode {

    public TupleExpr {
        elements = NodeLists.copy(elements);
        meta = NodeMeta.orEmpty(meta);
    }

    public TupleExpr(List<MetaNode> elements) {
        this(elements, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TUPLE;
    }

    @Override
    public List<MetaNode> children() {
        return elements;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTuple(this);
    }
}
