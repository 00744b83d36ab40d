package com.raditha.metaast.model;

import java.util.List;

/**
 * A key/value pair, normally an entry of a {@link MapExpr}.
 */
public record PairExpr(MetaNode key, MetaNode value, NodeMeta meta) implements MetaNode {

    public PairExpr {
        meta = NodeMeta.orEmpty(meta);
    }

    public PairExpr(MetaNode key, MetaNode value) {
        this(key, value, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PAIR;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(key, value);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitPair(this);
    }
}
