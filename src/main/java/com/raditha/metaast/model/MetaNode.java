package com.raditha.metaast.model;

import java.util.List;

/**
 * A node of the language-neutral tree.
 * <p>
 * Every node kind is a record implementing this interface. Nodes are immutable
 * once built; analyses never modify them and produce separate result values
 * instead.
 */
public sealed interface MetaNode permits
        Literal, Variable, ListExpr, MapExpr, PairExpr, TupleExpr,
        BinaryOp, UnaryOp, FunctionCall, Conditional, EarlyReturn, Block,
        Assignment, InlineMatch,
        Loop, Lambda, CollectionOp, PatternMatch, MatchArm, ExceptionHandling, AsyncOperation,
        Container, FunctionDef, Param, AttributeAccess, AugmentedAssignment, Property,
        LanguageSpecific {

    NodeKind kind();

    NodeMeta meta();

    /**
     * Child nodes in source order. Absent optional children are skipped.
     */
    List<MetaNode> children();

    <R> R accept(NodeVisitor<R> visitor);

    default Layer layer() {
        return kind().layer();
    }

    default boolean isLeaf() {
        return children().isEmpty();
    }
}
