package com.raditha.metaast.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.metaast.complexity.*;
import com.raditha.metaast.config.ComplexityThresholds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityFormatterTest {

    private ComplexityFormatter formatter;
    private ComplexityResult simple;
    private ComplexityResult tangled;

    @BeforeEach
    void setUp() {
        formatter = new ComplexityFormatter();
        simple = ComplexityResult.of(2, 1, 1, HalsteadMetrics.of(2, 2, 2, 4), LocMetrics.of(3, 5, 1),
                new FunctionMetrics(3, 1, 2), List.of(), ComplexityThresholds.defaults());
        tangled = ComplexityResult.of(12, 35, 4, HalsteadMetrics.EMPTY, LocMetrics.of(60, null, null),
                new FunctionMetrics(60, 4, 9),
                List.of(new FunctionComplexity("parse", 12, 35, 4, 60, 4, 9)),
                ComplexityThresholds.defaults());
    }

    @Test
    void testTextLayout() {
        String text = formatter.format(simple, ReportFormat.TEXT);

        assertTrue(text.startsWith("Complexity Analysis Results:\n\n"));
        assertTrue(text.contains("Cyclomatic Complexity: 2\n"));
        assertTrue(text.contains("Cognitive Complexity: 1\n"));
        assertTrue(text.contains("Max Nesting Depth: 1\n"));
        assertTrue(text.contains("  Volume: 12.0\n  Difficulty: 2.0\n  Effort: 24.0\n"));
        assertTrue(text.contains("  Logical: 3\n  Physical: 5\n"));
        assertTrue(text.contains("  Statements: 3\n  Return Points: 1\n  Variables: 2\n"));
        assertFalse(text.contains("[WARNING]"));
        assertFalse(text.contains("Per-Function Breakdown"));
        assertTrue(text.endsWith("  Variables: 2\n\nSummary: Code has low complexity"));
    }

    @Test
    void testWarningIndicators() {
        String text = formatter.format(tangled, ReportFormat.TEXT);

        assertTrue(text.contains("Cyclomatic Complexity: 12 [WARNING]"));
        assertTrue(text.contains("Cognitive Complexity: 35 [WARNING]"));
        assertTrue(text.contains("Max Nesting Depth: 4 [WARNING]"));
        assertTrue(text.contains("  Logical: 60 [WARNING]"));
        assertTrue(text.contains("    parse: CC=12, Cog=35, Nest=4, Stmts=60, Vars=9\n"));
        assertTrue(text.endsWith("Vars=9\n\nSummary: Code has high complexity with 4 warnings"));
    }

    @Test
    void testDetailedWithoutWarnings() {
        String detailed = formatter.format(simple, ReportFormat.DETAILED);

        assertTrue(detailed.endsWith("No warnings detected."));
        assertFalse(detailed.contains("Recommendations:"));
    }

    @Test
    void testDetailedWarningsAndRecommendations() {
        String detailed = formatter.format(tangled, ReportFormat.DETAILED);

        assertTrue(detailed.contains("Warnings:\n  - Cyclomatic complexity (12) exceeds warning threshold (10)"));
        assertTrue(detailed.contains("  - Cognitive complexity (35) exceeds error threshold (30)"));
        assertTrue(detailed.contains("Recommendations:"));
        assertEquals(4, formatter.recommendations(tangled).size());
        assertTrue(formatter.recommendations(tangled).get(3).startsWith("Function length (60 LoC)"));
    }

    @Test
    void testJson() throws Exception {
        JsonNode json = new ObjectMapper().readTree(formatter.format(tangled, ReportFormat.JSON));

        assertEquals(12, json.get("cyclomatic").asInt());
        assertEquals(4, json.get("max_nesting").asInt());
        assertEquals(0.0, json.get("halstead").get("volume").asDouble());
        assertEquals(60, json.get("loc").get("physical").asInt(), "Physical defaults to logical");
        assertEquals(9, json.get("function_metrics").get("variable_count").asInt());
        assertEquals("parse", json.get("per_function").get(0).get("name").asText());
        assertEquals(4, json.get("warnings").size());
        assertEquals(tangled.summary(), json.get("summary").asText());
    }

    @Test
    void testFormatByName() {
        assertEquals(ReportFormat.DETAILED, ReportFormat.fromName("detailed"));
        assertEquals(ReportFormat.JSON, ReportFormat.fromName("JSON"));
        assertThrows(IllegalArgumentException.class, () -> ReportFormat.fromName("xml"));
    }
}
