package com.raditha.metaast.similarity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.metaast.similarity.SimilarityTestSupport.tokens;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LCSSimilarity.
 */
class LCSSimilarityTest {

    private LCSSimilarity similarity;

    @BeforeEach
    void setUp() {
        similarity = new LCSSimilarity();
    }

    @Test
    void testIdenticalSequences() {
        double score = similarity.calculate(tokens("variable", "function_call", "variable"),
                tokens("variable", "function_call", "variable"));

        assertEquals(1.0, score, 0.001, "Identical sequences should have 100% similarity");
    }

    @Test
    void testCompletelyDifferent() {
        assertEquals(0.0, similarity.calculate(tokens("loop:while"), tokens("loop:for")), 0.001,
                "Completely different sequences should have 0% similarity");
    }

    @Test
    void testPartialMatch() {
        // A B C D vs A B X Y: LCS = 2, max length = 4
        assertEquals(0.5, similarity.calculate(tokens("a", "b", "c", "d"), tokens("a", "b", "x", "y")), 0.001);
    }

    @Test
    void testOrderMatters() {
        // a b c vs c b a: LCS = 1
        assertEquals(1.0 / 3.0, similarity.calculate(tokens("a", "b", "c"), tokens("c", "b", "a")), 0.001);
    }

    @Test
    void testDifferentLengths() {
        assertEquals(0.5, similarity.calculate(tokens("a", "b"), tokens("a", "b", "c", "d")), 0.001);
        assertEquals(0.5, similarity.calculate(tokens("a", "b", "c", "d"), tokens("a", "b")), 0.001,
                "Score must not depend on argument order");
    }

    @Test
    void testEmptySequences() {
        assertEquals(0.0, similarity.calculate(List.of(), tokens("a")), 0.001);
    }
}
