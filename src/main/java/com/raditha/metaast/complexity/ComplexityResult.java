package com.raditha.metaast.complexity;

import com.raditha.metaast.config.ComplexityThresholds;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Complexity metrics for one tree together with threshold warnings and a
 * one-line summary.
 */
public record ComplexityResult(
        int cyclomatic,
        int cognitive,
        int maxNesting,
        HalsteadMetrics halstead,
        LocMetrics loc,
        FunctionMetrics functionMetrics,
        List<FunctionComplexity> perFunction,
        List<String> warnings,
        String summary) {

    public ComplexityResult {
        perFunction = List.copyOf(perFunction);
        warnings = List.copyOf(warnings);
    }

    /**
     * Build a result, deriving warnings from the thresholds and the summary
     * from the metrics and warning count.
     */
    public static ComplexityResult of(
            int cyclomatic,
            int cognitive,
            int maxNesting,
            HalsteadMetrics halstead,
            LocMetrics loc,
            FunctionMetrics functionMetrics,
            List<FunctionComplexity> perFunction,
            ComplexityThresholds thresholds) {
        List<String> warnings = new ArrayList<>();
        check(warnings, "Cyclomatic complexity", cyclomatic,
                thresholds.cyclomaticWarning(), thresholds.cyclomaticError());
        check(warnings, "Cognitive complexity", cognitive,
                thresholds.cognitiveWarning(), thresholds.cognitiveError());
        check(warnings, "Nesting depth", maxNesting,
                thresholds.nestingWarning(), thresholds.nestingError());
        check(warnings, "Logical lines of code", loc.logical(),
                thresholds.locWarning(), thresholds.locError());

        return new ComplexityResult(cyclomatic, cognitive, maxNesting, halstead, loc, functionMetrics,
                perFunction, warnings, summarize(cyclomatic, cognitive, maxNesting, warnings.size()));
    }

    private static void check(List<String> warnings, String label, int value, int warning, int error) {
        if (value > error) {
            warnings.add(String.format("%s (%d) exceeds error threshold (%d)", label, value, error));
        } else if (value > warning) {
            warnings.add(String.format("%s (%d) exceeds warning threshold (%d)", label, value, warning));
        }
    }

    static String summarize(int cyclomatic, int cognitive, int nesting, int warningCount) {
        if (warningCount == 1) {
            return "Code has moderate complexity with 1 warning";
        }
        if (warningCount > 1) {
            return "Code has high complexity with " + warningCount + " warnings";
        }
        if (cyclomatic <= 5 && cognitive <= 7 && nesting <= 2) {
            return "Code has low complexity";
        }
        if (cyclomatic <= 10 && cognitive <= 15 && nesting <= 3) {
            return "Code has moderate complexity";
        }
        if (cyclomatic <= 20 && cognitive <= 30 && nesting <= 5) {
            return "Code has high complexity";
        }
        return "Code has very high complexity";
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * Combine results for several trees. Complexity and Halstead measures take
     * the maximum, line counts and function metrics are summed, warnings are
     * de-duplicated in order of first appearance.
     *
     * @throws IllegalArgumentException when {@code results} is empty
     */
    public static ComplexityResult merge(List<ComplexityResult> results) {
        if (results.isEmpty()) {
            throw new IllegalArgumentException("Cannot merge an empty list of results");
        }
        ComplexityResult first = results.get(0);
        int cyclomatic = first.cyclomatic;
        int cognitive = first.cognitive;
        int nesting = first.maxNesting;
        HalsteadMetrics halstead = first.halstead;
        LocMetrics loc = first.loc;
        FunctionMetrics functions = first.functionMetrics;
        List<FunctionComplexity> perFunction = new ArrayList<>(first.perFunction);
        Set<String> warnings = new LinkedHashSet<>(first.warnings);

        for (ComplexityResult result : results.subList(1, results.size())) {
            cyclomatic = Math.max(cyclomatic, result.cyclomatic);
            cognitive = Math.max(cognitive, result.cognitive);
            nesting = Math.max(nesting, result.maxNesting);
            halstead = halstead.max(result.halstead);
            loc = loc.plus(result.loc);
            functions = functions.plus(result.functionMetrics);
            perFunction.addAll(result.perFunction);
            warnings.addAll(result.warnings);
        }

        return new ComplexityResult(cyclomatic, cognitive, nesting, halstead, loc, functions, perFunction,
                new ArrayList<>(warnings), summarize(cyclomatic, cognitive, nesting, warnings.size()));
    }
}
