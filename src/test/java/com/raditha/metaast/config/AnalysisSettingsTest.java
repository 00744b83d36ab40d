package com.raditha.metaast.config;

import com.raditha.metaast.similarity.SimilarityMetric;
import com.raditha.metaast.tree.ValidationMode;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisSettingsTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testClasspathDefaultsMatchBuiltInDefaults() throws IOException {
        AnalysisSettings settings = AnalysisSettings.load();

        assertEquals(AnalysisSettings.defaults(), settings);
    }

    @Test
    void testYamlOverrides() throws IOException {
        AnalysisSettings settings = AnalysisSettings.load(yaml("""
                validation:
                  mode: strict
                  max_depth: 200
                complexity:
                  cyclomatic_warning: 5
                  cyclomatic_error: 8
                duplication:
                  preset: strict
                  similarity: weighted
                  weights:
                    jaccard: 0.5
                    lcs: 0.25
                    levenshtein: 0.25
                """));

        assertEquals(ValidationMode.STRICT, settings.validation().mode());
        assertEquals(200, settings.validation().maxDepth());
        assertEquals(10_000, settings.validation().maxVariables());

        assertEquals(5, settings.complexity().cyclomaticWarning());
        assertEquals(8, settings.complexity().cyclomaticError());
        assertEquals(15, settings.complexity().cognitiveWarning());

        assertEquals(0.90, settings.duplication().threshold());
        assertEquals(5, settings.duplication().minNodes());
        assertEquals(SimilarityMetric.WEIGHTED, settings.duplication().similarity());
        assertEquals(0.5, settings.duplication().weights().jaccardWeight());
    }

    @Test
    void testExplicitKeysOverridePreset() {
        AnalysisSettings settings = AnalysisSettings.fromMap(Map.of(
                "duplication", Map.of("preset", "lenient", "threshold", 0.75, "min_nodes", 3)));

        assertEquals(0.75, settings.duplication().threshold());
        assertEquals(3, settings.duplication().minNodes());
        assertEquals(SimilarityMetric.JACCARD, settings.duplication().similarity());
    }

    @Test
    void testEmptyMappingGivesDefaults() throws IOException {
        assertEquals(AnalysisSettings.defaults(), AnalysisSettings.load(yaml("{}")));
        assertEquals(AnalysisSettings.defaults(), AnalysisSettings.fromMap(Map.of("unrelated", 1)));
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> AnalysisSettings.load(yaml("duplication:\n  threshold: 1.5\n")));
        assertThrows(IllegalArgumentException.class, () -> AnalysisSettings.load(yaml("duplication:\n  similarity: cosine\n")));
        assertThrows(IllegalArgumentException.class, () -> AnalysisSettings.load(yaml("validation:\n  mode: lax\n")));
        assertThrows(IllegalArgumentException.class,
                () -> AnalysisSettings.load(yaml("complexity:\n  nesting_warning: 6\n  nesting_error: 4\n")));
    }
}
