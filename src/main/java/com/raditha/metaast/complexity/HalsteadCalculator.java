package com.raditha.metaast.complexity;

import com.raditha.metaast.model.*;
import com.raditha.metaast.tree.TreeWalker;

import java.util.HashMap;
import java.util.Map;

/**
 * Counts operators and operands in a single pass and derives Halstead metrics.
 * <p>
 * Operators are operator symbols and the keywords standing for control
 * constructs. Operands are variable names, canonical literal values and the
 * names of functions, parameters, attributes, properties and containers.
 */
public class HalsteadCalculator {

    public HalsteadMetrics calculate(MetaNode tree) {
        Walker walker = new Walker();
        walker.walk(tree);
        return HalsteadMetrics.of(
                walker.operators.size(),
                walker.operands.size(),
                total(walker.operators),
                total(walker.operands));
    }

    private static int total(Map<String, Integer> counts) {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    private static final class Walker extends TreeWalker {
        private final Map<String, Integer> operators = new HashMap<>();
        private final Map<String, Integer> operands = new HashMap<>();

        private void operator(String symbol) {
            operators.merge(symbol, 1, Integer::sum);
        }

        private void operand(String value) {
            if (value != null) {
                operands.merge(value, 1, Integer::sum);
            }
        }

        @Override
        public Void visitLiteral(Literal node) {
            operand(node.render());
            return descend(node);
        }

        @Override
        public Void visitVariable(Variable node) {
            operand(node.name());
            return descend(node);
        }

        @Override
        public Void visitList(ListExpr node) {
            operator("[]");
            return descend(node);
        }

        @Override
        public Void visitMap(MapExpr node) {
            operator("{}");
            return descend(node);
        }

        @Override
        public Void visitPair(PairExpr node) {
            operator("=>");
            return descend(node);
        }

        @Override
        public Void visitTuple(TupleExpr node) {
            operator("tuple");
            return descend(node);
        }

        @Override
        public Void visitBinaryOp(BinaryOp node) {
            operator(node.operator());
            return descend(node);
        }

        @Override
        public Void visitUnaryOp(UnaryOp node) {
            operator(node.operator());
            return descend(node);
        }

        @Override
        public Void visitFunctionCall(FunctionCall node) {
            operator("()");
            operand(node.name());
            return descend(node);
        }

        @Override
        public Void visitConditional(Conditional node) {
            operator("if");
            return descend(node);
        }

        @Override
        public Void visitEarlyReturn(EarlyReturn node) {
            operator("return");
            return descend(node);
        }

        @Override
        public Void visitAssignment(Assignment node) {
            operator("=");
            return descend(node);
        }

        @Override
        public Void visitInlineMatch(InlineMatch node) {
            operator("=");
            return descend(node);
        }

        @Override
        public Void visitLoop(Loop node) {
            operator(node.type().tag());
            return descend(node);
        }

        @Override
        public Void visitLambda(Lambda node) {
            operator("lambda");
            return descend(node);
        }

        @Override
        public Void visitCollectionOp(CollectionOp node) {
            operator(node.type().tag());
            return descend(node);
        }

        @Override
        public Void visitPatternMatch(PatternMatch node) {
            operator("case");
            return descend(node);
        }

        @Override
        public Void visitExceptionHandling(ExceptionHandling node) {
            operator("try");
            for (int i = 0; i < node.handlers().size(); i++) {
                operator("catch");
            }
            return descend(node);
        }

        @Override
        public Void visitAsyncOperation(AsyncOperation node) {
            operator(node.type().tag());
            return descend(node);
        }

        @Override
        public Void visitContainer(Container node) {
            operator(node.type().tag());
            operand(node.name());
            return descend(node);
        }

        @Override
        public Void visitFunctionDef(FunctionDef node) {
            operator("def");
            operand(node.name());
            return descend(node);
        }

        @Override
        public Void visitParam(Param node) {
            operand(node.name());
            return descend(node);
        }

        @Override
        public Void visitAttributeAccess(AttributeAccess node) {
            operator(".");
            operand(node.attribute());
            return descend(node);
        }

        @Override
        public Void visitAugmentedAssignment(AugmentedAssignment node) {
            operator(node.operator());
            return descend(node);
        }

        @Override
        public Void visitProperty(Property node) {
            operator("property");
            operand(node.name());
            return descend(node);
        }

        @Override
        public Void visitLanguageSpecific(LanguageSpecific node) {
            operator("native");
            return descend(node);
        }
    }
}
