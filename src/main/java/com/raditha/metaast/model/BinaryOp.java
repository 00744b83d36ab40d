package com.raditha.metaast.model;

import java.util.List;
import java.util.Set;

/**
 * A binary operator application.
 *
 * @param category operator category
 * @param operator operator symbol as written in the source, e.g. {@code +} or {@code and}
 * @param left     left operand
 * @param right    right operand
 * @param meta     node metadata
 */
public record BinaryOp(OperatorCategory category, String operator, MetaNode left, MetaNode right, NodeMeta meta)
        implements MetaNode {

    private static final Set<String> SHORT_CIRCUIT = Set.of("and", "or", "&&", "||");

    public BinaryOp {
        meta = NodeMeta.orEmpty(meta);
    }

    public BinaryOp(OperatorCategory category, String operator, MetaNode left, MetaNode right) {
        this(category, operator, left, right, NodeMeta.EMPTY);
    }

    public static BinaryOp arithmetic(String operator, MetaNode left, MetaNode right) {
        return new BinaryOp(OperatorCategory.ARITHMETIC, operator, left, right);
    }

    public static BinaryOp comparison(String operator, MetaNode left, MetaNode right) {
        return new BinaryOp(OperatorCategory.COMPARISON, operator, left, right);
    }

    public static BinaryOp and(MetaNode left, MetaNode right) {
        return new BinaryOp(OperatorCategory.BOOLEAN, "and", left, right);
    }

    public static BinaryOp or(MetaNode left, MetaNode right) {
        return new BinaryOp(OperatorCategory.BOOLEAN, "or", left, right);
    }

    /**
     * True for boolean {@code and}/{@code or}, the operators that add a decision point.
     */
    public boolean isShortCircuit() {
        return category == OperatorCategory.BOOLEAN && SHORT_CIRCUIT.contains(operator);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BINARY_OP;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(left, right);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }
}
