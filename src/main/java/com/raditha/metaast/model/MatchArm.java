package com.raditha.metaast.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One branch of a pattern match, or one handler clause of an exception block.
 * A missing pattern stands for a catch-all arm.
 */
public record MatchArm(@Nullable MetaNode pattern, @Nullable MetaNode guard, List<MetaNode> body, NodeMeta meta)
        implements MetaNode {

    public MatchArm {
        body = NodeLists.copy(body);
        meta = NodeMeta.orEmpty(meta);
    }

    public MatchArm(@Nullable MetaNode pattern, List<MetaNode> body) {
        this(pattern, null, body, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MATCH_ARM;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(pattern, guard, body);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMatchArm(this);
    }
}
