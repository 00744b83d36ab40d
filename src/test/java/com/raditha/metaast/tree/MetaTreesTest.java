package com.raditha.metaast.tree;

import com.raditha.metaast.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetaTreesTest {

    @Test
    void testLeafDepthIsOne() {
        assertEquals(1, MetaTrees.depth(new Variable("x")));
        assertEquals(1, MetaTrees.nodeCount(new Variable("x")));
    }

    @Test
    void testPreorder() {
        MetaNode a = new Variable("a");
        MetaNode b = Literal.integer(2);
        MetaNode sum = BinaryOp.arithmetic("+", a, b);
        MetaNode call = new FunctionCall("print", List.of(sum, new Variable("c")));

        List<MetaNode> order = MetaTrees.preorder(call);

        assertEquals(5, order.size());
        assertSame(call, order.get(0));
        assertSame(sum, order.get(1));
        assertSame(a, order.get(2));
        assertSame(b, order.get(3));
    }

    @Test
    void testVariablesIncludeParamsInFirstSeenOrder() {
        FunctionDef function = new FunctionDef("f", List.of(new Param("n")), List.of(
                new Assignment(new Variable("total"), BinaryOp.arithmetic("*", new Variable("n"), new Variable("k")))));

        assertEquals(List.of("n", "total", "k"), List.copyOf(MetaTrees.variables(function)));
    }

    @Test
    void testStats() {
        MetaNode tree = Block.of(
                new LanguageSpecific("python", "decorator", null),
                Loop.forEach(new Variable("i"), new Variable("items"), Block.of(new FunctionCall("use", List.of()))));

        TreeStats stats = MetaTrees.stats(tree);

        assertEquals(7, stats.nodeCount());
        assertEquals(4, stats.depth());
        assertEquals(Layer.NATIVE, stats.layer());
        assertEquals(1, stats.nativeCount());
        assertEquals(1, MetaTrees.nativeCount(tree));
        assertEquals(2, stats.variableCount());
    }

    @Test
    void testDeepTreeTraversal() {
        MetaNode tree = new Variable("leaf");
        for (int i = 0; i < 20_000; i++) {
            tree = new UnaryOp(OperatorCategory.ARITHMETIC, "-", tree);
        }

        assertEquals(20_001, MetaTrees.depth(tree));
        assertEquals(20_001, MetaTrees.preorder(tree).size());
    }
}
