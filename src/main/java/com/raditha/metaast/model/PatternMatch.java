package com.raditha.metaast.model;

import java.util.List;

/**
 * A case/switch/match expression with one arm per branch.
 */
public record PatternMatch(MetaNode scrutinee, List<MatchArm> arms, NodeMeta meta) implements MetaNode {

    public PatternMatch {
        arms = NodeLists.copy(arms);
        meta = NodeMeta.orEmpty(meta);
    }

    public PatternMatch(MetaNode scrutinee, List<MatchArm> arms) {
        this(scrutinee, arms, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PATTERN_MATCH;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(scrutinee, arms);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitPatternMatch(this);
    }
}
