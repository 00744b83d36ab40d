package com.raditha.metaast.model;

import java.util.List;

/**
 * Destructuring bind of a pattern against a value, e.g. {@code {a, b} = pair}.
 */
public record InlineMatch(MetaNode pattern, MetaNode value, NodeMeta meta) implements MetaNode {

    public InlineMatch {
        meta = NodeMeta.orEmpty(meta);
    }

    public InlineMatch(MetaNode pattern, MetaNode value) {
        this(pattern, value, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INLINE_MATCH;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(pattern, value);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitInlineMatch(this);
    }
}
