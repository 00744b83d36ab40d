package com.raditha.metaast.model;

import java.util.List;

/**
 * A module, class or namespace holding definitions.
 */
public record Container(ContainerType type, String name, List<MetaNode> body, NodeMeta meta) implements MetaNode {

    public Container {
        body = NodeLists.copy(body);
        meta = NodeMeta.orEmpty(meta);
    }

    public Container(ContainerType type, String name, List<MetaNode> body) {
        this(type, name, body, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONTAINER;
    }

    @Override
    public List<MetaNode> children() {
        return body;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitContainer(this);
    }
}
