package com.raditha.metaast.model;

import java.util.List;

public record UnaryOp(OperatorCategory category, String operator, MetaNode operand, NodeMeta meta)
        implements MetaNode {

    public UnaryOp {
        meta = NodeMeta.orEmpty(meta);
    }

    public UnaryOp(OperatorCategory category, String operator, MetaNode operand) {
        this(category, operator, operand, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNARY_OP;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(operand);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }
}
