package com.raditha.metaast.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A higher order operation over a collection. Only {@link CollectionOpType#REDUCE}
 * carries an initial value.
 */
public record CollectionOp(
        CollectionOpType type,
        MetaNode function,
        MetaNode collection,
        @Nullable MetaNode initial,
        NodeMeta meta) implements MetaNode {

    public CollectionOp {
        meta = NodeMeta.orEmpty(meta);
    }

    public CollectionOp(CollectionOpType type, MetaNode function, MetaNode collection) {
        this(type, function, collection, null, NodeMeta.EMPTY);
    }

    public static CollectionOp reduce(MetaNode function, MetaNode collection, MetaNode initial) {
        return new CollectionOp(CollectionOpType.REDUCE, function, collection, initial, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COLLECTION_OP;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(function, collection, initial);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCollectionOp(this);
    }
}
