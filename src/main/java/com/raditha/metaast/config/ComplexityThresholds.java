package com.raditha.metaast.config;

/**
 * Warning and error levels for complexity metrics. A metric strictly greater
 * than a level triggers it.
 */
public record ComplexityThresholds(
        int cyclomaticWarning,
        int cyclomaticError,
        int cognitiveWarning,
        int cognitiveError,
        int nestingWarning,
        int nestingError,
        int locWarning,
        int locError) {

    public ComplexityThresholds {
        checkPair("cyclomatic", cyclomaticWarning, cyclomaticError);
        checkPair("cognitive", cognitiveWarning, cognitiveError);
        checkPair("nesting", nestingWarning, nestingError);
        checkPair("loc", locWarning, locError);
    }

    private static void checkPair(String metric, int warning, int error) {
        if (warning < 0) {
            throw new IllegalArgumentException(metric + " warning threshold must be >= 0");
        }
        if (error < warning) {
            throw new IllegalArgumentException(metric + " error threshold must be >= warning threshold");
        }
    }

    /**
     * Default levels: cyclomatic 10/20, cognitive 15/30, nesting 3/5, logical LOC 50/100.
     */
    public static ComplexityThresholds defaults() {
        return new ComplexityThresholds(10, 20, 15, 30, 3, 5, 50, 100);
    }

    /**
     * Tighter levels for code that should stay small.
     */
    public static ComplexityThresholds strict() {
        return new ComplexityThresholds(5, 10, 8, 15, 2, 4, 30, 60);
    }
}
