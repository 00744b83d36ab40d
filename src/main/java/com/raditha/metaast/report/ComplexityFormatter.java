package com.raditha.metaast.report;

import com.raditha.metaast.complexity.ComplexityResult;
import com.raditha.metaast.complexity.FunctionComplexity;
import com.raditha.metaast.complexity.HalsteadMetrics;
import com.raditha.metaast.complexity.LocMetrics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders complexity results.
 * <p>
 * The text layout shows one metric per line with a {@code [WARNING]} suffix
 * where a threshold was exceeded. The detailed layout adds the warnings and
 * recommendations keyed to the default thresholds.
 */
public class ComplexityFormatter {

    private static final int CYCLOMATIC_LIMIT = 10;
    private static final int COGNITIVE_LIMIT = 15;
    private static final int NESTING_LIMIT = 3;
    private static final int LOC_LIMIT = 50;

    public String format(ComplexityResult result, ReportFormat format) {
        return switch (format) {
            case TEXT -> formatText(result);
            case JSON -> JsonWriter.write(toMap(result));
            case DETAILED -> formatDetailed(result);
        };
    }

    String formatText(ComplexityResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Complexity Analysis Results:\n\n");
        sb.append("Cyclomatic Complexity: ").append(result.cyclomatic())
                .append(indicator(result, "Cyclomatic")).append("\n");
        sb.append("Cognitive Complexity: ").append(result.cognitive())
                .append(indicator(result, "Cognitive")).append("\n");
        sb.append("Max Nesting Depth: ").append(result.maxNesting())
                .append(indicator(result, "Nesting")).append("\n\n");

        HalsteadMetrics halstead = result.halstead();
        sb.append("Halstead Metrics:\n");
        sb.append("  Volume: ").append(decimal(halstead.volume())).append("\n");
        sb.append("  Difficulty: ").append(decimal(halstead.difficulty())).append("\n");
        sb.append("  Effort: ").append(decimal(halstead.effort())).append("\n\n");

        LocMetrics loc = result.loc();
        sb.append("Lines of Code:\n");
        sb.append("  Logical: ").append(loc.logical()).append(indicator(result, "Logical lines")).append("\n");
        sb.append("  Physical: ").append(loc.physical()).append("\n\n");

        sb.append("Function Metrics:\n");
        sb.append("  Statements: ").append(result.functionMetrics().statementCount()).append("\n");
        sb.append("  Return Points: ").append(result.functionMetrics().returnPoints()).append("\n");
        sb.append("  Variables: ").append(result.functionMetrics().variableCount()).append("\n");

        if (!result.perFunction().isEmpty()) {
            sb.append("\n  Per-Function Breakdown:\n");
            for (FunctionComplexity function : result.perFunction()) {
                sb.append("    ").append(function.name())
                        .append(": CC=").append(function.cyclomatic())
                        .append(", Cog=").append(function.cognitive())
                        .append(", Nest=").append(function.maxNesting())
                        .append(", Stmts=").append(function.statements())
                        .append(", Vars=").append(function.variables()).append("\n");
            }
        }
        sb.append("\nSummary: ").append(result.summary());
        return sb.toString();
    }

    String formatDetailed(ComplexityResult result) {
        StringBuilder sb = new StringBuilder(formatText(result));
        if (result.warnings().isEmpty()) {
            sb.append("\n\nNo warnings detected.");
        } else {
            sb.append("\n\nWarnings:");
            for (String warning : result.warnings()) {
                sb.append("\n  - ").append(warning);
            }
        }

        List<String> recommendations = recommendations(result);
        if (!recommendations.isEmpty()) {
            sb.append("\n\nRecommendations:");
            for (String recommendation : recommendations) {
                sb.append("\n  - ").append(recommendation);
            }
        }
        return sb.toString();
    }

    List<String> recommendations(ComplexityResult result) {
        List<String> recommendations = new ArrayList<>();
        if (result.cyclomatic() > CYCLOMATIC_LIMIT) {
            recommendations.add("Consider breaking down complex logic (cyclomatic > 10) into smaller functions");
        }
        if (result.cognitive() > COGNITIVE_LIMIT) {
            recommendations.add(
                    "Reduce nesting depth and conditional complexity (cognitive > 15) for better readability");
        }
        if (result.maxNesting() > NESTING_LIMIT) {
            recommendations.add(
                    "Deeply nested code (depth > 3) is hard to understand. Extract nested logic into functions");
        }
        int logical = result.loc().logical();
        if (logical > LOC_LIMIT) {
            recommendations.add("Function length (" + logical + " LoC) exceeds 50 lines. Consider splitting it");
        }
        return recommendations;
    }

    Map<String, Object> toMap(ComplexityResult result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("cyclomatic", result.cyclomatic());
        map.put("cognitive", result.cognitive());
        map.put("max_nesting", result.maxNesting());

        HalsteadMetrics h = result.halstead();
        Map<String, Object> halstead = new LinkedHashMap<>();
        halstead.put("distinct_operators", h.distinctOperators());
        halstead.put("distinct_operands", h.distinctOperands());
        halstead.put("total_operators", h.totalOperators());
        halstead.put("total_operands", h.totalOperands());
        halstead.put("vocabulary", h.vocabulary());
        halstead.put("length", h.length());
        halstead.put("volume", h.volume());
        halstead.put("difficulty", h.difficulty());
        halstead.put("effort", h.effort());
        map.put("halstead", halstead);

        LocMetrics l = result.loc();
        Map<String, Object> loc = new LinkedHashMap<>();
        loc.put("physical", l.physical());
        loc.put("logical", l.logical());
        loc.put("comments", l.comments());
        loc.put("blank", l.blank());
        map.put("loc", loc);

        Map<String, Object> functions = new LinkedHashMap<>();
        functions.put("statement_count", result.functionMetrics().statementCount());
        functions.put("return_points", result.functionMetrics().returnPoints());
        functions.put("variable_count", result.functionMetrics().variableCount());
        map.put("function_metrics", functions);

        List<Map<String, Object>> perFunction = new ArrayList<>();
        for (FunctionComplexity f : result.perFunction()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", f.name());
            entry.put("cyclomatic", f.cyclomatic());
            entry.put("cognitive", f.cognitive());
            entry.put("max_nesting", f.maxNesting());
            entry.put("statements", f.statements());
            entry.put("return_points", f.returnPoints());
            entry.put("variables", f.variables());
            perFunction.add(entry);
        }
        map.put("per_function", perFunction);
        map.put("warnings", result.warnings());
        map.put("summary", result.summary());
        return map;
    }

    private static String indicator(ComplexityResult result, String metric) {
        for (String warning : result.warnings()) {
            if (warning.startsWith(metric)) {
                return " [WARNING]";
            }
        }
        return "";
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
