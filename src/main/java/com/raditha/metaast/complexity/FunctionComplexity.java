package com.raditha.metaast.complexity;

/**
 * Complexity of one function definition.
 */
public record FunctionComplexity(
        String name,
        int cyclomatic,
        int cognitive,
        int maxNesting,
        int statements,
        int returnPoints,
        int variables) {
}
