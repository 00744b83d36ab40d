package com.raditha.metaast.config;

import com.raditha.metaast.similarity.SimilarityMetric;
import com.raditha.metaast.similarity.SimilarityStrategy;

/**
 * Configuration for clone detection.
 *
 * @param threshold  minimum token similarity for a near-miss clone (0.0-1.0)
 * @param similarity algorithm used to score token sequences
 * @param weights    weights used when {@code similarity} is {@link SimilarityMetric#WEIGHTED}
 * @param minNodes   trees with fewer nodes are left out of batch grouping
 */
public record DuplicationConfig(
        double threshold,
        SimilarityMetric similarity,
        SimilarityWeights weights,
        int minNodes) {

    public static final double DEFAULT_THRESHOLD = 0.8;

    /**
     * Validate configuration.
     */
    public DuplicationConfig {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        if (similarity == null) {
            throw new IllegalArgumentException("similarity cannot be null");
        }
        if (weights == null) {
            throw new IllegalArgumentException("weights cannot be null");
        }
        if (minNodes < 1) {
            throw new IllegalArgumentException("minNodes must be >= 1");
        }
    }

    /**
     * Moderate preset: 80% threshold with multiset Jaccard scoring.
     * Good default for most projects.
     */
    public static DuplicationConfig moderate() {
        return new DuplicationConfig(DEFAULT_THRESHOLD, SimilarityMetric.JACCARD, SimilarityWeights.balanced(), 1);
    }

    /**
     * Strict preset: 90% threshold, ignores trivial trees.
     */
    public static DuplicationConfig strict() {
        return new DuplicationConfig(0.90, SimilarityMetric.JACCARD, SimilarityWeights.balanced(), 5);
    }

    /**
     * Lenient preset: 70% threshold, catches more near-miss clones at the cost of false positives.
     */
    public static DuplicationConfig lenient() {
        return new DuplicationConfig(0.70, SimilarityMetric.JACCARD, SimilarityWeights.balanced(), 1);
    }

    /**
     * Resolve a preset by name, falling back to {@link #moderate()}.
     */
    public static DuplicationConfig preset(String name) {
        if (name == null) {
            return moderate();
        }
        return switch (name) {
            case "strict" -> strict();
            case "lenient" -> lenient();
            default -> moderate();
        };
    }

    public DuplicationConfig withThreshold(double newThreshold) {
        return new DuplicationConfig(newThreshold, similarity, weights, minNodes);
    }

    public DuplicationConfig withSimilarity(SimilarityMetric metric) {
        return new DuplicationConfig(threshold, metric, weights, minNodes);
    }

    /**
     * Build the scoring strategy this configuration selects.
     */
    public SimilarityStrategy createStrategy() {
        return similarity.create(weights);
    }
}
