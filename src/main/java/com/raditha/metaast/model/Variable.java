package com.raditha.metaast.model;

import java.util.List;

/**
 * A reference to a named identifier.
 */
public record Variable(String name, NodeMeta meta) implements MetaNode {

    public Variable {
        meta = NodeMeta.orEmpty(meta);
    }

    public Variable(String name) {
        this(name, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VARIABLE;
    }

    @Override
    public List<MetaNode> children() {
        return List.of();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
