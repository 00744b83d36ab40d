package com.raditha.metaast.duplication;

import com.raditha.metaast.config.DuplicationConfig;
import com.raditha.metaast.document.Document;
import com.raditha.metaast.model.*;
import com.raditha.metaast.similarity.SimilarityMetric;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DuplicationDetectorTest {

    private DuplicationDetector detector;

    @BeforeEach
    void setUp() {
        detector = new DuplicationDetector();
    }

    static MetaNode sum(String target, String left, String right) {
        return new Assignment(new Variable(target),
                BinaryOp.arithmetic("+", new Variable(left), new Variable(right)));
    }

    /**
     * Three increments and a call; the first increment uses the given operator.
     */
    static MetaNode increments(String firstOperator) {
        return Block.of(
                new Assignment(new Variable("x"), BinaryOp.arithmetic(firstOperator, new Variable("x"), Literal.integer(1))),
                new Assignment(new Variable("y"), BinaryOp.arithmetic("+", new Variable("y"), Literal.integer(2))),
                new Assignment(new Variable("z"), BinaryOp.arithmetic("+", new Variable("z"), Literal.integer(3))),
                new FunctionCall("print", List.of(new Variable("x"))));
    }

    @Test
    void testExactClone() {
        DuplicationResult result = detector.detect(sum("r", "x", "y"), sum("r", "x", "y"));

        assertTrue(result.duplicate());
        assertEquals(CloneType.TYPE_I, result.cloneType());
        assertEquals(1.0, result.similarity());
        assertTrue(result.differences().isEmpty());
        assertEquals("Exact clone detected (Type I)", result.summary());
    }

    @Test
    void testRenamedClone() {
        DuplicationResult result = detector.detect(sum("result", "x", "y"), sum("total", "a", "b"));

        assertTrue(result.duplicate());
        assertEquals(CloneType.TYPE_II, result.cloneType());
        assertEquals(1.0, result.similarity());
        assertEquals("Renamed clone detected (Type II)", result.summary());
        assertEquals(3, result.differences().size());
        Difference first = result.differences().get(0);
        assertEquals(Difference.Type.RENAME, first.type());
        assertEquals("variable", first.role());
        assertEquals("result", first.original());
        assertEquals("total", first.revised());
    }

    @Test
    void testLiteralChangeIsTypeTwo() {
        DuplicationResult result = detector.detect(
                new Assignment(new Variable("x"), Literal.integer(1)),
                new Assignment(new Variable("x"), Literal.integer(2)));

        assertEquals(CloneType.TYPE_II, result.cloneType());
        assertEquals(List.of(new Difference(Difference.Type.VALUE_CHANGE, 1, "literal", "1", "2")),
                result.differences());
    }

    @Test
    void testNearMissClone() {
        DuplicationResult result = detector.detect(increments("+"), increments("-"));

        assertTrue(result.duplicate());
        assertEquals(CloneType.TYPE_III, result.cloneType());
        assertEquals(17.0 / 19.0, result.similarity(), 0.0001);
        assertEquals("Near-miss clone detected (Type III) - 89.5% similar", result.summary());

        assertEquals(1, result.differences().size());
        Difference change = result.differences().get(0);
        assertEquals(Difference.Type.CHANGE, change.type());
        assertEquals(3, change.position());
        assertEquals("binary_op:arithmetic:+", change.original());
        assertEquals("binary_op:arithmetic:-", change.revised());
    }

    @Test
    void testThresholdDecidesNearMiss() {
        DuplicationDetector strict = new DuplicationDetector(DuplicationConfig.strict());

        DuplicationResult result = strict.detect(increments("+"), increments("-"));

        assertFalse(result.duplicate());
        assertEquals(CloneType.NONE, result.cloneType());
        assertEquals("No duplication detected", result.summary());
    }

    @Test
    void testAlternativeSimilarityMetric() {
        DuplicationDetector lcs = new DuplicationDetector(
                DuplicationConfig.moderate().withSimilarity(SimilarityMetric.LCS));

        DuplicationResult result = lcs.detect(increments("+"), increments("-"));

        assertEquals(17.0 / 18.0, result.similarity(), 0.0001);
        assertEquals(CloneType.TYPE_III, result.cloneType());
    }

    @Test
    void testUnrelatedTrees() {
        DuplicationResult result = detector.detect(
                Literal.integer(1),
                Loop.whileLoop(new Variable("running"), Block.of(new FunctionCall("tick", List.of()))));

        assertFalse(result.duplicate());
        assertEquals(CloneType.NONE, result.cloneType());
        assertEquals(0.0, result.similarity());
        assertFalse(result.differences().isEmpty());
    }

    @Test
    void testCrossLanguageMatchIsTypeFour() {
        Document python = new Document(sum("r", "x", "y"), "python");
        Document ruby = new Document(sum("r", "x", "y"), "ruby");

        DuplicationResult result = detector.detect(python, ruby);

        assertTrue(result.duplicate());
        assertEquals(CloneType.TYPE_IV, result.cloneType());
        assertEquals(CloneType.TYPE_I, result.matchType());
        assertEquals("Semantic clone detected (Type IV) - 100.0% similar", result.summary());
    }

    @Test
    void testLanguageTagCaseDoesNotMakeTypeFour() {
        Document upper = new Document(sum("r", "x", "y"), "Python");
        Document lower = new Document(sum("r", "x", "y"), "python");

        DuplicationResult result = detector.detect(upper, lower);

        assertEquals(CloneType.TYPE_I, result.cloneType());
        assertEquals("Exact clone detected (Type I)", result.summary());
    }

    @Test
    void testCrossLanguageNonCloneStaysNone() {
        DuplicationResult result = detector.detect(
                new Document(Literal.integer(1), "python"),
                new Document(new Variable("x"), "ruby"));

        assertEquals(CloneType.NONE, result.cloneType());
    }

    @Test
    void testLocationsAndMetrics() {
        Document first = new Document(sum("r", "x", "y"), "python",
                Map.of(Document.FILE, "calc.py", Document.START_LINE, 10, Document.END_LINE, 12), null);
        Document second = new Document(sum("r", "x", "y"), "python");

        DuplicationResult result = detector.detect(first, second);

        assertEquals(new CloneLocation("calc.py", 10, 12, "python"), result.locations().get(0));
        assertEquals(new CloneLocation(null, null, null, "python"), result.locations().get(1));
        assertEquals(5, result.metrics().size());
        assertEquals(3, result.metrics().variables());
        assertEquals(64, result.fingerprints().exact().length());
    }

    @Test
    void testLocationFallsBackToNodeLines() {
        MetaNode located = new Variable("x", NodeMeta.atLine(7));

        CloneLocation location = CloneLocation.of(Document.of(located));

        assertEquals(7, location.startLine());
        assertEquals("unknown:7-? (unknown)", location.toString());
    }
}
