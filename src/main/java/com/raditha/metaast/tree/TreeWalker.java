package com.raditha.metaast.tree;

import com.raditha.metaast.model.*;
import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Pre-order tree walk driven by an explicit work stack instead of call
 * recursion, so arbitrarily deep trees cannot overflow the thread stack.
 * <p>
 * Each visit method decides which children to walk next and at which nesting
 * level by calling {@link #visitChild(MetaNode, int)}. Children scheduled
 * during one visit are walked in the order they were scheduled. The default
 * for every kind is to walk all children at the current nesting level.
 * <p>
 * Instances hold per-walk state and must not be shared between threads.
 */
public abstract class TreeWalker implements NodeVisitor<Void> {

    private final Deque<Frame> stack = new ArrayDeque<>();
    private final List<Frame> scheduled = new ArrayList<>();
    private int nesting;

    private record Frame(MetaNode node, int nesting) {
    }

    /**
     * Walk the tree rooted at {@code root}, starting at nesting level 0.
     */
    public void walk(@Nullable MetaNode root) {
        stack.clear();
        if (root == null) {
            return;
        }
        stack.push(new Frame(root, 0));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            nesting = frame.nesting();
            scheduled.clear();
            beforeVisit(frame.node());
            frame.node().accept(this);
            for (int i = scheduled.size() - 1; i >= 0; i--) {
                stack.push(scheduled.get(i));
            }
        }
    }

    /**
     * Hook called for every node before its visit method.
     */
    protected void beforeVisit(MetaNode node) {
    }

    /**
     * Nesting level of the node currently being visited.
     */
    protected final int nesting() {
        return nesting;
    }

    /**
     * Schedule a child to be walked at the given nesting level. Null children are ignored.
     */
    protected final void visitChild(@Nullable MetaNode child, int level) {
        if (child != null) {
            scheduled.add(new Frame(child, level));
        }
    }

    protected final void visitChildren(List<? extends MetaNode> children, int level) {
        for (MetaNode child : children) {
            visitChild(child, level);
        }
    }

    /**
     * Walk every child at the current nesting level.
     */
    protected Void descend(MetaNode node) {
        visitChildren(node.children(), nesting);
        return null;
    }

    @Override
    public Void visitLiteral(Literal node) {
        return descend(node);
    }

    @Override
    public Void visitVariable(Variable node) {
        return descend(node);
    }

    @Override
    public Void visitList(ListExpr node) {
        return descend(node);
    }

    @Override
    public Void visitMap(MapExpr node) {
        return descend(node);
    }

    @Override
    public Void visitPair(PairExpr node) {
        return descend(node);
    }

    @Override
    public Void visitTuple(TupleExpr node) {
        return descend(node);
    }

    @Override
    public Void visitBinaryOp(BinaryOp node) {
        return descend(node);
    }

    @Override
    public Void visitUnaryOp(UnaryOp node) {
        return descend(node);
    }

    @Override
    public Void visitFunctionCall(FunctionCall node) {
        return descend(node);
    }

    @Override
    public Void visitConditional(Conditional node) {
        return descend(node);
    }

    @Override
    public Void visitEarlyReturn(EarlyReturn node) {
        return descend(node);
    }

    @Override
    public Void visitBlock(Block node) {
        return descend(node);
    }

    @Override
    public Void visitAssignment(Assignment node) {
        return descend(node);
    }

    @Override
    public Void visitInlineMatch(InlineMatch node) {
        return descend(node);
    }

    @Override
    public Void visitLoop(Loop node) {
        return descend(node);
    }

    @Override
    public Void visitLambda(Lambda node) {
        return descend(node);
    }

    @Override
    public Void visitCollectionOp(CollectionOp node) {
        return descend(node);
    }

    @Override
    public Void visitPatternMatch(PatternMatch node) {
        return descend(node);
    }

    @Override
    public Void visitMatchArm(MatchArm node) {
        return descend(node);
    }

    @Override
    public Void visitExceptionHandling(ExceptionHandling node) {
        return descend(node);
    }

    @Override
    public Void visitAsyncOperation(AsyncOperation node) {
        return descend(node);
    }

    @Override
    public Void visitContainer(Container node) {
        return descend(node);
    }

    @Override
    public Void visitFunctionDef(FunctionDef node) {
        return descend(node);
    }

    @Override
    public Void visitParam(Param node) {
        return descend(node);
    }

    @Override
    public Void visitAttributeAccess(AttributeAccess node) {
        return descend(node);
    }

    @Override
    public Void visitAugmentedAssignment(AugmentedAssignment node) {
        return descend(node);
    }

    @Override
    public Void visitProperty(Property node) {
        return descend(node);
    }

    @Override
    public Void visitLanguageSpecific(LanguageSpecific node) {
        return descend(node);
    }
}
