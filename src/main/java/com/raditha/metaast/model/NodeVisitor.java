package com.raditha.metaast.model;

/**
 * Visitor over every node kind.
 *
 * @param <R> result type of a single visit
 */
public interface NodeVisitor<R> {

    R visitLiteral(Literal node);

    R visitVariable(Variable node);

    R visitList(ListExpr node);

    R visitMap(MapExpr node);

    R visitPair(PairExpr node);

    R visitTuple(TupleExpr node);

    R visitBinaryOp(BinaryOp node);

    R visitUnaryOp(UnaryOp node);

    R visitFunctionCall(FunctionCall node);

    R visitConditional(Conditional node);

    R visitEarlyReturn(EarlyReturn node);

    R visitBlock(Block node);

    R visitAssignment(Assignment node);

    R visitInlineMatch(InlineMatch node);

    R visitLoop(Loop node);

    R visitLambda(Lambda node);

    R visitCollectionOp(CollectionOp node);

    R visitPatternMatch(PatternMatch node);

    R visitMatchArm(MatchArm node);

    R visitExceptionHandling(ExceptionHandling node);

    R visitAsyncOperation(AsyncOperation node);

    R visitContainer(Container node);

    R visitFunctionDef(FunctionDef node);

    R visitParam(Param node);

    R visitAttributeAccess(AttributeAccess node);

    R visitAugmentedAssignment(AugmentedAssignment node);

    R visitProperty(Property node);

    R visitLanguageSpecific(LanguageSpecific node);
}
