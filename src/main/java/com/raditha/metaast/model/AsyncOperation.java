package com.raditha.metaast.model;

import java.util.List;

public record AsyncOperation(AsyncType type, MetaNode operation, NodeMeta meta) implements MetaNode {

    public AsyncOperation {
        meta = NodeMeta.orEmpty(meta);
    }

    public AsyncOperation(AsyncType type, MetaNode operation) {
        this(type, operation, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASYNC_OPERATION;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(operation);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAsyncOperation(this);
    }
}
