package com.raditha.metaast.model;

import java.util.List;

/**
 * A sequence of statements.
 */
public record Block(List<MetaNode> statements, NodeMeta meta) implements MetaNode {

    public Block {
        statements = NodeLists.copy(statements);
        meta = NodeMeta.orEmpty(meta);
    }

    public Block(List<MetaNode> statements) {
        this(statements, NodeMeta.EMPTY);
    }

    public static Block of(MetaNode... statements) {
        return new Block(List.of(statements));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BLOCK;
    }

    @Override
    public List<MetaNode> children() {
        return statements;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
