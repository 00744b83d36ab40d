package com.raditha.metaast.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A return (or equivalent jump out of the enclosing function), with an optional value.
 */
public record EarlyReturn(@Nullable MetaNode value, NodeMeta meta) implements MetaNode {

    public EarlyReturn {
        meta = NodeMeta.orEmpty(meta);
    }

    public EarlyReturn(@Nullable MetaNode value) {
        this(value, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EARLY_RETURN;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(value);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitEarlyReturn(this);
    }
}
