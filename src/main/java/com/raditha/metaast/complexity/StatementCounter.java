package com.raditha.metaast.complexity;

import com.raditha.metaast.model.*;
import com.raditha.metaast.tree.TreeWalker;

/**
 * Counts statement-level nodes and early returns.
 * <p>
 * Only statement positions are walked: block entries, branches, loop bodies,
 * try, handler and else blocks, arm bodies, lambda, function and container
 * bodies, and the bodies of native nodes. Expressions below a statement are
 * not entered, so a statement is counted once however complex its operands.
 * Both branches of every conditional are followed since reachability is not
 * evaluated here.
 */
public class StatementCounter {

    /**
     * Counts gathered by one walk.
     */
    public record Counts(int statements, int returnPoints) {
    }

    public Counts count(MetaNode tree) {
        Walker walker = new Walker();
        walker.walk(tree);
        return new Counts(walker.statements, walker.returns);
    }

    private static final class Walker extends TreeWalker {
        private int statements;
        private int returns;

        @Override
        protected Void descend(MetaNode node) {
            // expression: neither counted nor entered
            return null;
        }

        private Void statement() {
            statements++;
            return null;
        }

        @Override
        public Void visitBlock(Block node) {
            visitChildren(node.statements(), nesting());
            return null;
        }

        @Override
        public Void visitAssignment(Assignment node) {
            return statement();
        }

        @Override
        public Void visitInlineMatch(InlineMatch node) {
            return statement();
        }

        @Override
        public Void visitFunctionCall(FunctionCall node) {
            return statement();
        }

        @Override
        public Void visitAugmentedAssignment(AugmentedAssignment node) {
            return statement();
        }

        @Override
        public Void visitProperty(Property node) {
            return statement();
        }

        @Override
        public Void visitAsyncOperation(AsyncOperation node) {
            return statement();
        }

        @Override
        public Void visitEarlyReturn(EarlyReturn node) {
            returns++;
            return statement();
        }

        @Override
        public Void visitConditional(Conditional node) {
            visitChild(node.thenBranch(), nesting());
            visitChild(node.elseBranch(), nesting());
            return statement();
        }

        @Override
        public Void visitLoop(Loop node) {
            visitChild(node.body(), nesting());
            return statement();
        }

        @Override
        public Void visitExceptionHandling(ExceptionHandling node) {
            visitChild(node.tryBlock(), nesting());
            for (MatchArm handler : node.handlers()) {
                visitChildren(handler.body(), nesting());
            }
            visitChild(node.elseBlock(), nesting());
            return statement();
        }

        @Override
        public Void visitPatternMatch(PatternMatch node) {
            for (MatchArm arm : node.arms()) {
                visitChildren(arm.body(), nesting());
            }
            return statement();
        }

        @Override
        public Void visitMatchArm(MatchArm node) {
            visitChildren(node.body(), nesting());
            return null;
        }

        @Override
        public Void visitLambda(Lambda node) {
            visitChildren(node.body(), nesting());
            return statement();
        }

        @Override
        public Void visitContainer(Container node) {
            visitChildren(node.body(), nesting());
            return statement();
        }

        @Override
        public Void visitFunctionDef(FunctionDef node) {
            visitChildren(node.body(), nesting());
            return statement();
        }

        @Override
        public Void visitLanguageSpecific(LanguageSpecific node) {
            visitChildren(node.body(), nesting());
            return statement();
        }
    }
}
