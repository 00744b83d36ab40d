package com.raditha.metaast.complexity;

/**
 * @param statementCount statement-level nodes
 * @param returnPoints   early returns on any path
 * @param variableCount  distinct variable and parameter names
 */
public record FunctionMetrics(int statementCount, int returnPoints, int variableCount) {

    public static final FunctionMetrics EMPTY = new FunctionMetrics(0, 0, 0);

    public FunctionMetrics plus(FunctionMetrics other) {
        return new FunctionMetrics(
                statementCount + other.statementCount,
                returnPoints + other.returnPoints,
                variableCount + other.variableCount);
    }
}
