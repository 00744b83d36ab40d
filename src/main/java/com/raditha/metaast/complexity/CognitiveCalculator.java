package com.raditha.metaast.complexity;

import com.raditha.metaast.model.BinaryOp;
import com.raditha.metaast.model.MetaNode;

/**
 * Cognitive complexity: a readability measure that penalizes nesting.
 * <p>
 * Conditionals, loops, exception handling blocks and pattern-match arms add
 * {@code 1 + nesting}; boolean {@code and}/{@code or} add a flat 1.
 */
public class CognitiveCalculator {

    public int calculate(MetaNode tree) {
        Walker walker = new Walker();
        walker.walk(tree);
        return walker.score;
    }

    private static final class Walker extends NestingWalker {
        private int score;

        @Override
        protected void onNestedConstruct(MetaNode node, int nesting) {
            score += 1 + nesting;
        }

        @Override
        protected void onShortCircuit(BinaryOp node) {
            score++;
        }
    }
}
