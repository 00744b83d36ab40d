package com.raditha.metaast.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A property with an optional getter and setter.
 */
public record Property(String name, @Nullable MetaNode getter, @Nullable MetaNode setter, NodeMeta meta)
        implements MetaNode {

    public Property {
        meta = NodeMeta.orEmpty(meta);
    }

    public Property(String name, @Nullable MetaNode getter, @Nullable MetaNode setter) {
        this(name, getter, setter, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PROPERTY;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(getter, setter);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitProperty(this);
    }
}
