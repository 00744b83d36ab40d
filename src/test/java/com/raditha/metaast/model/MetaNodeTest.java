package com.raditha.metaast.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetaNodeTest {

    @Test
    void testLiteralRendering() {
        assertEquals("42", Literal.integer(42).render());
        assertEquals("1.5", Literal.decimal(1.5).render());
        assertEquals("\"say \\\"hi\\\"\"", Literal.string("say \"hi\"").render());
        assertEquals("true", Literal.bool(true).render());
        assertEquals("null", Literal.nil().render());
        assertEquals(":ok", Literal.symbol("ok").render());
        assertEquals("~r/a+/", new Literal(LiteralType.REGEX, "a+").render());
    }

    @ParameterizedTest
    @CsvSource({
            "BOOLEAN, and, true",
            "BOOLEAN, ||, true",
            "BOOLEAN, xor, false",
            "ARITHMETIC, +, false",
            "COMPARISON, ==, false"
    })
    void testShortCircuit(OperatorCategory category, String operator, boolean expected) {
        BinaryOp op = new BinaryOp(category, operator, new Variable("a"), new Variable("b"));
        assertEquals(expected, op.isShortCircuit());
    }

    @Test
    void testLoopHeader() {
        Variable condition = new Variable("running");
        Variable items = new Variable("items");

        assertSame(condition, Loop.whileLoop(condition, Block.of()).header());
        assertSame(items, Loop.forEach(new Variable("i"), items, Block.of()).header());
        assertNull(Loop.forLoop(new Variable("i"), items, Block.of()).condition());
    }

    @Test
    void testChildrenSkipMissingParts() {
        Conditional noElse = new Conditional(new Variable("c"), new Variable("t"), null);
        assertEquals(2, noElse.children().size());

        FunctionDef function = new FunctionDef("f", List.of(new Param("a"), new Param("b")),
                List.of(new EarlyReturn(null)));
        List<MetaNode> children = function.children();
        assertEquals(3, children.size());
        assertInstanceOf(Param.class, children.get(0));
        assertInstanceOf(EarlyReturn.class, children.get(2));
        assertThrows(UnsupportedOperationException.class, () -> children.add(new Variable("x")));
    }

    @Test
    void testLayers() {
        assertEquals(Layer.CORE, new Variable("x").layer());
        assertEquals(Layer.EXTENDED, Loop.whileLoop(new Variable("c"), Block.of()).layer());
        assertEquals(Layer.STRUCTURAL, new Param("p").layer());
        assertEquals(Layer.NATIVE, new LanguageSpecific("go", "defer", null).layer());
        assertEquals(Layer.STRUCTURAL, Layer.EXTENDED.max(Layer.STRUCTURAL));
        assertEquals(Layer.EXTENDED, Layer.EXTENDED.max(Layer.CORE));
    }

    @Test
    void testMetaIsCopiedAndLocationAware() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put(NodeMeta.LINE, 3);
        NodeMeta meta = new NodeMeta(attributes);
        attributes.put(NodeMeta.LINE, 30);

        assertEquals(3, meta.line().getAsInt());
        assertTrue(meta.endLine().isEmpty());
        assertEquals(9, meta.with(NodeMeta.END_LINE, 9).endLine().getAsInt());
        assertTrue(NodeMeta.orEmpty(null).isEmpty());
        assertSame(NodeMeta.EMPTY, new Variable("x").meta());
    }

    @Test
    void testVisitorDispatch() {
        NodeVisitor<String> namer = new KindNamer();

        assertEquals("variable", new Variable("x").accept(namer));
        assertEquals("loop", Loop.whileLoop(new Variable("c"), Block.of()).accept(namer));
        assertEquals("language_specific", new LanguageSpecific("go", "defer", null).accept(namer));
    }

    @Test
    void testLiteralTypeAcceptance() {
        assertTrue(LiteralType.INTEGER.accepts(7L));
        assertFalse(LiteralType.INTEGER.accepts(7.0));
        assertTrue(LiteralType.FLOAT.accepts(7.0));
        assertTrue(LiteralType.NULL.accepts(null));
        assertFalse(LiteralType.STRING.accepts(null));
    }

    /**
     * Answers the kind tag of every node.
     */
    private static final class KindNamer implements NodeVisitor<String> {
        private static String tag(MetaNode node) {
            return node.kind().tag();
        }

        @Override public String visitLiteral(Literal node) { return tag(node); }
        @Override public String visitVariable(Variable node) { return tag(node); }
        @Override public String visitList(ListExpr node) { return tag(node); }
        @Override public String visitMap(MapExpr node) { return tag(node); }
        @Override public String visitPair(PairExpr node) { return tag(node); }
        @Override public String visitTuple(TupleExpr node) { return tag(node); }
        @Override public String visitBinaryOp(BinaryOp node) { return tag(node); }
        @Override public String visitUnaryOp(UnaryOp node) { return tag(node); }
        @Override public String visitFunctionCall(FunctionCall node) { return tag(node); }
        @Override public String visitConditional(Conditional node) { return tag(node); }
        @Override public String visitEarlyReturn(EarlyReturn node) { return tag(node); }
        @Override public String visitBlock(Block node) { return tag(node); }
        @Override public String visitAssignment(Assignment node) { return tag(node); }
        @Override public String visitInlineMatch(InlineMatch node) { return tag(node); }
        @Override public String visitLoop(Loop node) { return tag(node); }
        @Override public String visitLambda(Lambda node) { return tag(node); }
        @Override public String visitCollectionOp(CollectionOp node) { return tag(node); }
        @Override public String visitPatternMatch(PatternMatch node) { return tag(node); }
        @Override public String visitMatchArm(MatchArm node) { return tag(node); }
        @Override public String visitExceptionHandling(ExceptionHandling node) { return tag(node); }
        @Override public String visitAsyncOperation(AsyncOperation node) { return tag(node); }
        @Override public String visitContainer(Container node) { return tag(node); }
        @Override public String visitFunctionDef(FunctionDef node) { return tag(node); }
        @Override public String visitParam(Param node) { return tag(node); }
        @Override public String visitAttributeAccess(AttributeAccess node) { return tag(node); }
        @Override public String visitAugmentedAssignment(AugmentedAssignment node) { return tag(node); }
        @Override public String visitProperty(Property node) { return tag(node); }
        @Override public String visitLanguageSpecific(LanguageSpecific node) { return tag(node); }
    }
}
