package com.raditha.metaast.clustering;

import com.raditha.metaast.config.DuplicationConfig;
import com.raditha.metaast.document.Document;
import com.raditha.metaast.duplication.CloneType;
import com.raditha.metaast.duplication.DuplicationDetector;
import com.raditha.metaast.fingerprint.Fingerprinter;
import com.raditha.metaast.model.*;
import com.raditha.metaast.similarity.SimilarityStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CloneGrouperTest {

    @Mock
    private SimilarityStrategy strategy;

    private CloneGrouper grouper;

    @BeforeEach
    void setUp() {
        grouper = new CloneGrouper(DuplicationConfig.moderate());
    }

    private static Document python(MetaNode tree) {
        return new Document(tree, "python");
    }

    private static MetaNode sum(String target, String left, String right) {
        return new Assignment(new Variable(target),
                BinaryOp.arithmetic("+", new Variable(left), new Variable(right)));
    }

    private static MetaNode increments(String firstOperator) {
        return Block.of(
                new Assignment(new Variable("x"), BinaryOp.arithmetic(firstOperator, new Variable("x"), Literal.integer(1))),
                new Assignment(new Variable("y"), BinaryOp.arithmetic("+", new Variable("y"), Literal.integer(2))),
                new Assignment(new Variable("z"), BinaryOp.arithmetic("+", new Variable("z"), Literal.integer(3))),
                new FunctionCall("print", List.of(new Variable("x"))));
    }

    @Test
    void testExactCopiesFormTypeOneGroup() {
        List<CloneGroup> groups = grouper.group(List.of(
                python(sum("r", "x", "y")),
                python(sum("r", "x", "y")),
                python(sum("r", "x", "y"))));

        assertEquals(1, groups.size());
        assertEquals(CloneType.TYPE_I, groups.get(0).cloneType());
        assertEquals(3, groups.get(0).size());
    }

    @Test
    void testMixedGroupsInInputOrder() {
        Document d1 = python(sum("r", "x", "y"));
        Document d2 = python(sum("r", "x", "y"));
        Document d3 = python(sum("total", "a", "b"));
        Document d4 = python(increments("+"));
        Document d5 = python(increments("-"));
        Document d6 = python(Literal.string("lonely"));

        List<CloneGroup> groups = grouper.group(List.of(d1, d4, d2, d6, d5, d3));

        assertEquals(2, groups.size(), "Singletons should not form groups");

        CloneGroup renamed = groups.get(0);
        assertEquals(CloneType.TYPE_II, renamed.cloneType());
        assertEquals(List.of(d1, d2, d3), renamed.documents());

        CloneGroup nearMiss = groups.get(1);
        assertEquals(CloneType.TYPE_III, nearMiss.cloneType());
        assertEquals(List.of(d4, d5), nearMiss.documents());
        assertEquals(2, nearMiss.locations().size());
    }

    @Test
    void testLanguagesDifferGivesTypeFour() {
        List<CloneGroup> groups = grouper.group(List.of(
                python(sum("r", "x", "y")),
                new Document(sum("r", "x", "y"), "ruby")));

        assertEquals(1, groups.size());
        assertEquals(CloneType.TYPE_IV, groups.get(0).cloneType());
        assertEquals("ruby", groups.get(0).locations().get(1).language());
    }

    @Test
    void testSmallTreesAreIgnored() {
        CloneGrouper strict = new CloneGrouper(DuplicationConfig.strict());

        List<CloneGroup> groups = strict.group(List.of(
                python(Literal.integer(1)),
                python(Literal.integer(1)),
                python(increments("+")),
                python(increments("+"))));

        assertEquals(1, groups.size());
        assertEquals(2, groups.get(0).size());
        assertEquals(CloneType.TYPE_I, groups.get(0).cloneType());
    }

    @Test
    void testEmptyAndSingleInput() {
        assertTrue(grouper.group(List.of()).isEmpty());
        assertTrue(grouper.group(List.of(python(Literal.integer(1)))).isEmpty());
    }

    @Test
    void testChainedSimilarityMergesNonTransitively() {
        when(strategy.calculate(anyList(), anyList())).thenReturn(0.9, 0.1, 0.9);
        CloneGrouper mocked = new CloneGrouper(DuplicationConfig.moderate(), new Fingerprinter(), strategy);

        List<CloneGroup> groups = mocked.group(List.of(
                python(Literal.integer(1)),
                python(new Variable("x")),
                python(new FunctionCall("f", List.of()))));

        assertEquals(1, groups.size(), "A and C should join through B");
        assertEquals(3, groups.get(0).size());
        assertEquals(CloneType.TYPE_III, groups.get(0).cloneType());
        verify(strategy, times(3)).calculate(anyList(), anyList());
    }

    @Test
    void testBucketedCopiesAreScoredOnce() {
        when(strategy.calculate(anyList(), anyList())).thenReturn(0.0);
        CloneGrouper mocked = new CloneGrouper(DuplicationConfig.moderate(), new Fingerprinter(), strategy);

        mocked.group(List.of(
                python(sum("r", "x", "y")),
                python(sum("a", "b", "c")),
                python(sum("d", "e", "f")),
                python(Literal.integer(1))));

        verify(strategy, times(1)).calculate(anyList(), anyList());
    }

    @Test
    void testDetectorBatchDelegatesToGrouper() {
        DuplicationDetector detector = new DuplicationDetector();

        List<CloneGroup> groups = detector.detectBatch(List.of(
                python(sum("r", "x", "y")),
                python(sum("s", "x", "y"))));

        assertEquals(1, groups.size());
        assertEquals(CloneType.TYPE_II, groups.get(0).cloneType());
    }

    @Test
    void testUnionFindKeepsLowestIndexAsRoot() {
        CloneGrouper.UnionFind unionFind = new CloneGrouper.UnionFind(4);

        unionFind.union(3, 2);
        unionFind.union(2, 1);

        assertEquals(1, unionFind.find(3));
        assertEquals(1, unionFind.find(2));
        assertEquals(0, unionFind.find(0));
    }
}
