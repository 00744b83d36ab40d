package com.raditha.metaast.complexity;

import com.raditha.metaast.RandomTrees;
import com.raditha.metaast.model.Conditional;
import com.raditha.metaast.model.Literal;
import com.raditha.metaast.model.MetaNode;
import com.raditha.metaast.model.Variable;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityPropertiesTest {

    private final ComplexityAnalyzer analyzer = new ComplexityAnalyzer();

    @Provide
    Arbitrary<Long> seeds() {
        return Arbitraries.longs();
    }

    @Property(tries = 200)
    void metricsAreNeverNegative(@ForAll("seeds") long seed) {
        ComplexityResult result = analyzer.analyze(RandomTrees.statement(seed));

        assertTrue(result.cyclomatic() >= 1);
        assertTrue(result.cognitive() >= 0);
        assertTrue(result.maxNesting() >= 0);
        assertTrue(result.halstead().volume() >= 0.0);
    }

    @Property(tries = 200)
    void volumeIsZeroForEmptyVocabularyOrLength(@ForAll("seeds") long seed) {
        HalsteadMetrics halstead = analyzer.analyze(RandomTrees.statement(seed)).halstead();

        if (halstead.length() == 0 || halstead.vocabulary() == 0) {
            assertEquals(0.0, halstead.volume());
        }
        if (halstead.vocabulary() > 1) {
            assertTrue(halstead.volume() > 0.0);
        }
    }

    @Property(tries = 20)
    void nestedConditionalsFollowTriangularLaw(@ForAll @IntRange(min = 1, max = 20) int k) {
        MetaNode tree = Literal.integer(0);
        for (int level = k; level >= 1; level--) {
            tree = new Conditional(new Variable("c" + level), tree, Literal.integer(level));
        }

        ComplexityResult result = analyzer.analyze(tree);

        assertEquals(k * (k + 1) / 2, result.cognitive());
        assertEquals(k, result.maxNesting());
        assertEquals(k + 1, result.cyclomatic());
    }

    @Example
    void deepTreesDoNotOverflowTheStack() {
        MetaNode tree = Literal.integer(0);
        for (int i = 0; i < 20_000; i++) {
            tree = new Conditional(new Variable("c"), tree, null);
        }

        ComplexityResult result = analyzer.analyze(tree);

        assertEquals(20_001, result.cyclomatic());
        assertEquals(20_000, result.maxNesting());
    }
}
