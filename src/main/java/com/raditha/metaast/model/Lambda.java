package com.raditha.metaast.model;

import java.util.List;

/**
 * An anonymous function.
 */
public record Lambda(List<Param> params, List<MetaNode> body, NodeMeta meta) implements MetaNode {

    public Lambda {
        params = NodeLists.copy(params);
        body = NodeLists.copy(body);
        meta = NodeMeta.orEmpty(meta);
    }

    public Lambda(List<Param> params, List<MetaNode> body) {
        this(params, body, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LAMBDA;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(params, body);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLambda(this);
    }
}
