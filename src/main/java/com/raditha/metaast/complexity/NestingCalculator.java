package com.raditha.metaast.complexity;

import com.raditha.metaast.model.MetaNode;

/**
 * Maximum nesting depth of control structures.
 */
public class NestingCalculator {

    public int calculate(MetaNode tree) {
        Walker walker = new Walker();
        walker.walk(tree);
        return walker.max;
    }

    private static final class Walker extends NestingWalker {
        private int max;

        @Override
        protected void beforeVisit(MetaNode node) {
            max = Math.max(max, nesting());
        }
    }
}
