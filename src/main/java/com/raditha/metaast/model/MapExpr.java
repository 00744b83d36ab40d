package com.raditha.metaast.model;

import java.util.List;

/**
 * A map literal made of {@link PairExpr} entries.
 */
public record MapExpr(List<PairExpr> entries, NodeMeta meta) implements MetaNode {

    public MapExpr {
        entries = NodeLists.copy(entries);
        meta = NodeMeta.orEmpty(meta);
    }

    public MapExpr(List<PairExpr> entries) {
        this(entries, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MAP;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(entries);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMap(this);
    }
}
