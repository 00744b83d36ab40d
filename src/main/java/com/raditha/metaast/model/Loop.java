package com.raditha.metaast.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A loop. While loops carry a condition; for and for-each loops carry an
 * iterator and the collection it ranges over.
 *
 * @param type       loop kind
 * @param iterator   loop variable, absent for while loops
 * @param collection iterated collection, absent for while loops
 * @param condition  loop condition, absent for iterator loops
 * @param body       loop body
 * @param meta       node metadata
 */
public record Loop(
        LoopType type,
        @Nullable MetaNode iterator,
        @Nullable MetaNode collection,
        @Nullable MetaNode condition,
        MetaNode body,
        NodeMeta meta) implements MetaNode {

    public Loop {
        meta = NodeMeta.orEmpty(meta);
    }

    public static Loop whileLoop(MetaNode condition, MetaNode body) {
        return new Loop(LoopType.WHILE, null, null, condition, body, NodeMeta.EMPTY);
    }

    public static Loop forLoop(MetaNode iterator, MetaNode collection, MetaNode body) {
        return new Loop(LoopType.FOR, iterator, collection, null, body, NodeMeta.EMPTY);
    }

    public static Loop forEach(MetaNode iterator, MetaNode collection, MetaNode body) {
        return new Loop(LoopType.FOR_EACH, iterator, collection, null, body, NodeMeta.EMPTY);
    }

    /**
     * The node that decides whether another iteration runs.
     */
    public @Nullable MetaNode header() {
        return type.isConditional() ? condition : collection;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LOOP;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(iterator, collection, condition, body);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLoop(this);
    }
}
