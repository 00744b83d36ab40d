package com.raditha.metaast.complexity;

import com.raditha.metaast.model.*;
import com.raditha.metaast.tree.TreeWalker;

/**
 * McCabe cyclomatic complexity: one plus the number of decision points.
 * <p>
 * Decision points are conditionals, loops, boolean {@code and}/{@code or}
 * operators, exception handler clauses and pattern-match arms. Nesting does
 * not matter.
 */
public class CyclomaticCalculator {

    public int calculate(MetaNode tree) {
        Walker walker = new Walker();
        walker.walk(tree);
        return walker.complexity;
    }

    private static final class Walker extends TreeWalker {
        private int complexity = 1;

        @Override
        public Void visitConditional(Conditional node) {
            complexity++;
            return descend(node);
        }

        @Override
        public Void visitLoop(Loop node) {
            complexity++;
            return descend(node);
        }

        @Override
        public Void visitBinaryOp(BinaryOp node) {
            if (node.isShortCircuit()) {
                complexity++;
            }
            return descend(node);
        }

        @Override
        public Void visitExceptionHandling(ExceptionHandling node) {
            complexity += node.handlers().size();
            return descend(node);
        }

        @Override
        public Void visitPatternMatch(PatternMatch node) {
            complexity += node.arms().size();
            return descend(node);
        }
    }
}
