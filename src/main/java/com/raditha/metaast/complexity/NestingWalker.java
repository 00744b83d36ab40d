package com.raditha.metaast.complexity;

import com.raditha.metaast.model.*;
import com.raditha.metaast.tree.TreeWalker;

/**
 * Walks a tree applying the nesting rules shared by cognitive complexity and
 * nesting depth.
 * <p>
 * Nesting grows by one when entering a conditional branch, a loop body, the
 * try, handler or else block of exception handling, a lambda body, a match
 * arm body and a function body. Conditions, iterators, collections, patterns
 * and guards stay at the enclosing level.
 */
abstract class NestingWalker extends TreeWalker {

    /**
     * Called for every construct that adds a nesting-weighted increment:
     * conditionals, loops, exception handling blocks and pattern-match arms.
     */
    protected void onNestedConstruct(MetaNode node, int nesting) {
    }

    /**
     * Called for boolean {@code and}/{@code or} operators.
     */
    protected void onShortCircuit(BinaryOp node) {
    }

    @Override
    public Void visitConditional(Conditional node) {
        int level = nesting();
        onNestedConstruct(node, level);
        visitChild(node.condition(), level);
        visitChild(node.thenBranch(), level + 1);
        visitChild(node.elseBranch(), level + 1);
        return null;
    }

    @Override
    public Void visitLoop(Loop node) {
        int level = nesting();
        onNestedConstruct(node, level);
        visitChild(node.iterator(), level);
        visitChild(node.collection(), level);
        visitChild(node.condition(), level);
        visitChild(node.body(), level + 1);
        return null;
    }

    @Override
    public Void visitBinaryOp(BinaryOp node) {
        if (node.isShortCircuit()) {
            onShortCircuit(node);
        }
        return descend(node);
    }

    @Override
    public Void visitExceptionHandling(ExceptionHandling node) {
        int level = nesting();
        onNestedConstruct(node, level);
        visitChild(node.tryBlock(), level + 1);
        for (MatchArm handler : node.handlers()) {
            visitChild(handler.pattern(), level);
            visitChild(handler.guard(), level);
            visitChildren(handler.body(), level + 1);
        }
        visitChild(node.elseBlock(), level + 1);
        return null;
    }

    @Override
    public Void visitPatternMatch(PatternMatch node) {
        int level = nesting();
        visitChild(node.scrutinee(), level);
        for (MatchArm arm : node.arms()) {
            onNestedConstruct(arm, level);
            visitChild(arm.pattern(), level);
            visitChild(arm.guard(), level);
            visitChildren(arm.body(), level + 1);
        }
        return null;
    }

    @Override
    public Void visitMatchArm(MatchArm node) {
        int level = nesting();
        visitChild(node.pattern(), level);
        visitChild(node.guard(), level);
        visitChildren(node.body(), level + 1);
        return null;
    }

    @Override
    public Void visitLambda(Lambda node) {
        int level = nesting();
        visitChildren(node.params(), level);
        visitChildren(node.body(), level + 1);
        return null;
    }

    @Override
    public Void visitFunctionDef(FunctionDef node) {
        int level = nesting();
        visitChildren(node.params(), level);
        visitChild(node.guard(), level);
        visitChildren(node.body(), level + 1);
        return null;
    }
}
