package com.raditha.metaast.tree;

/**
 * Limits and thresholds applied by {@link TreeValidator}.
 *
 * @param mode               strictness
 * @param maxDepth           hard depth limit, exceeding it rejects the tree
 * @param maxVariables       hard limit on distinct variable names
 * @param deepNestingWarning depth above which a warning is attached
 * @param largeTreeWarning   node count above which a warning is attached
 */
public record ValidationOptions(
        ValidationMode mode,
        int maxDepth,
        int maxVariables,
        int deepNestingWarning,
        int largeTreeWarning) {

    public static final int DEFAULT_MAX_DEPTH = 1000;
    public static final int DEFAULT_MAX_VARIABLES = 10_000;

    public ValidationOptions {
        if (mode == null) {
            mode = ValidationMode.STANDARD;
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1");
        }
        if (maxVariables < 0) {
            throw new IllegalArgumentException("maxVariables must be >= 0");
        }
        if (deepNestingWarning < 0 || largeTreeWarning < 0) {
            throw new IllegalArgumentException("warning thresholds must be >= 0");
        }
    }

    public static ValidationOptions defaults() {
        return new ValidationOptions(ValidationMode.STANDARD, DEFAULT_MAX_DEPTH, DEFAULT_MAX_VARIABLES, 100, 1000);
    }

    public static ValidationOptions strict() {
        return defaults().withMode(ValidationMode.STRICT);
    }

    public ValidationOptions withMode(ValidationMode newMode) {
        return new ValidationOptions(newMode, maxDepth, maxVariables, deepNestingWarning, largeTreeWarning);
    }

    public ValidationOptions withLimits(int newMaxDepth, int newMaxVariables) {
        return new ValidationOptions(mode, newMaxDepth, newMaxVariables, deepNestingWarning, largeTreeWarning);
    }
}
