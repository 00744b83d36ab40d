package com.raditha.metaast.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raditha.metaast.similarity.SimilarityMetric;
import com.raditha.metaast.tree.ValidationMode;
import com.raditha.metaast.tree.ValidationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;

/**
 * Loads analysis configuration from YAML.
 * <p>
 * Three sections are recognized: {@code validation}, {@code complexity} and
 * {@code duplication}. Missing sections and keys fall back to the defaults of
 * the corresponding configuration record.
 *
 * @param validation   tree validation options
 * @param complexity   complexity thresholds
 * @param duplication  clone detection configuration
 */
public record AnalysisSettings(
        ValidationOptions validation,
        ComplexityThresholds complexity,
        DuplicationConfig duplication) {

    public static final String DEFAULT_RESOURCE = "metaast.yml";

    private static final Logger logger = LoggerFactory.getLogger(AnalysisSettings.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(ValidationOptions.defaults(), ComplexityThresholds.defaults(),
                DuplicationConfig.moderate());
    }

    /**
     * Load settings from {@value #DEFAULT_RESOURCE} on the classpath, or the
     * defaults when the resource is absent.
     */
    public static AnalysisSettings load() throws IOException {
        try (InputStream in = AnalysisSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.debug("{} not found on classpath, using defaults", DEFAULT_RESOURCE);
                return defaults();
            }
            return load(in);
        }
    }

    /**
     * Load settings from a YAML stream.
     */
    public static AnalysisSettings load(InputStream in) throws IOException {
        Map<String, Object> root = YAML.readValue(in, new TypeReference<Map<String, Object>>() {
        });
        return fromMap(root == null ? Map.of() : root);
    }

    /**
     * Build settings from an already parsed configuration map.
     */
    public static AnalysisSettings fromMap(Map<String, Object> config) {
        return new AnalysisSettings(
                buildValidation(section(config, "validation")),
                buildComplexity(section(config, "complexity")),
                buildDuplication(section(config, "duplication")));
    }

    private static ValidationOptions buildValidation(Map<String, Object> config) {
        ValidationOptions defaults = ValidationOptions.defaults();
        String mode = getString(config, "mode", defaults.mode().name());
        return new ValidationOptions(
                ValidationMode.valueOf(mode.toUpperCase(Locale.ROOT)),
                getInt(config, "max_depth", defaults.maxDepth()),
                getInt(config, "max_variables", defaults.maxVariables()),
                getInt(config, "deep_nesting_warning", defaults.deepNestingWarning()),
                getInt(config, "large_tree_warning", defaults.largeTreeWarning()));
    }

    private static ComplexityThresholds buildComplexity(Map<String, Object> config) {
        ComplexityThresholds d = ComplexityThresholds.defaults();
        return new ComplexityThresholds(
                getInt(config, "cyclomatic_warning", d.cyclomaticWarning()),
                getInt(config, "cyclomatic_error", d.cyclomaticError()),
                getInt(config, "cognitive_warning", d.cognitiveWarning()),
                getInt(config, "cognitive_error", d.cognitiveError()),
                getInt(config, "nesting_warning", d.nestingWarning()),
                getInt(config, "nesting_error", d.nestingError()),
                getInt(config, "loc_warning", d.locWarning()),
                getInt(config, "loc_error", d.locError()));
    }

    private static DuplicationConfig buildDuplication(Map<String, Object> config) {
        // Preset first, explicit keys override it
        DuplicationConfig base = DuplicationConfig.preset(getString(config, "preset", null));
        SimilarityMetric metric = SimilarityMetric.fromName(
                getString(config, "similarity", base.similarity().name()));
        return new DuplicationConfig(
                getDouble(config, "threshold", base.threshold()),
                metric,
                buildWeights(section(config, "weights"), base.weights()),
                getInt(config, "min_nodes", base.minNodes()));
    }

    private static SimilarityWeights buildWeights(Map<String, Object> config, SimilarityWeights fallback) {
        if (config.isEmpty()) {
            return fallback;
        }
        return new SimilarityWeights(
                getDouble(config, "jaccard", fallback.jaccardWeight()),
                getDouble(config, "lcs", fallback.lcsWeight()),
                getDouble(config, "levenshtein", fallback.levenshteinWeight()));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
