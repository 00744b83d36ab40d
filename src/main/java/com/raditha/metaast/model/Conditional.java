package com.raditha.metaast.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * An if/else construct. The else branch may be absent.
 */
public record Conditional(MetaNode condition, MetaNode thenBranch, @Nullable MetaNode elseBranch, NodeMeta meta)
        implements MetaNode {

    public Conditional {
        meta = NodeMeta.orEmpty(meta);
    }

    public Conditional(MetaNode condition, MetaNode thenBranch, @Nullable MetaNode elseBranch) {
        this(condition, thenBranch, elseBranch, NodeMeta.EMPTY);
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONDITIONAL;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(condition, thenBranch, elseBranch);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}
