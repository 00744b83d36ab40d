package com.raditha.metaast.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A try block with handler clauses and an optional else block that runs when
 * nothing was raised.
 */
public record ExceptionHandling(MetaNode tryBlock, List<MatchArm> handlers, @Nullable MetaNode elseBlock, NodeMeta meta)
        implements MetaNode {

    public ExceptionHandling {
        handlers = NodeLists.copy(handlers);
        meta = NodeMeta.orEmpty(meta);
    }

    public ExceptionHandling(MetaNode tryBlock, List<MatchArm> handlers, @Nullable MetaNode elseBlock) {
        this(tryBlock, handlers, elseBlock, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXCEPTION_HANDLING;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(tryBlock, handlers, elseBlock);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitExceptionHandling(this);
    }
}
