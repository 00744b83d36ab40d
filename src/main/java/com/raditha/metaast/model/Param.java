package com.raditha.metaast.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A formal parameter with an optional destructuring pattern and default value.
 */
public record Param(String name, @Nullable MetaNode pattern, @Nullable MetaNode defaultValue, NodeMeta meta)
        implements MetaNode {

    public Param {
        meta = NodeMeta.orEmpty(meta);
    }

    public Param(String name) {
        this(name, null, null, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PARAM;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(pattern, defaultValue);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitParam(this);
    }
}
