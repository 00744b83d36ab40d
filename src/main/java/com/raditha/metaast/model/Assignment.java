package com.raditha.metaast.model;

import java.util.List;

public record Assignment(MetaNode target, MetaNode value, NodeMeta meta) implements MetaNode {

    public Assignment {
        meta = NodeMeta.orEmpty(meta);
    }

    public Assignment(MetaNode target, MetaNode value) {
        this(target, value, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGNMENT;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(target, value);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }
}
