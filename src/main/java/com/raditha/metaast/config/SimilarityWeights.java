package com.raditha.metaast.config;

/**
 * Weights for combining token similarity metrics into one score.
 *
 * @param jaccardWeight     weight of the token multiset overlap (0.0-1.0)
 * @param lcsWeight         weight of the longest common subsequence score (0.0-1.0)
 * @param levenshteinWeight weight of the edit distance score (0.0-1.0)
 */
public record SimilarityWeights(
        double jaccardWeight,
        double lcsWeight,
        double levenshteinWeight) {
    /**
     * Validate weights sum to 1.0.
     */
    public SimilarityWeights {
        if (jaccardWeight < 0 || lcsWeight < 0 || levenshteinWeight < 0) {
            throw new IllegalArgumentException("Weights must not be negative");
        }
        double sum = jaccardWeight + lcsWeight + levenshteinWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException(
                    String.format("Weights must sum to 1.0, got %.3f", sum));
        }
    }

    /**
     * Balanced weights (default): token content and token order count about equally.
     */
    public static SimilarityWeights balanced() {
        return new SimilarityWeights(0.40, 0.30, 0.30);
    }

    /**
     * Order sensitive weights: emphasizes the sequence of constructs.
     */
    public static SimilarityWeights ordered() {
        return new SimilarityWeights(0.20, 0.40, 0.40);
    }

    /**
     * Content weights: emphasizes which constructs appear, not where.
     */
    public static SimilarityWeights content() {
        return new SimilarityWeights(0.60, 0.20, 0.20);
    }

    /**
     * Calculate combined score from individual metrics.
     */
    public double combine(double jaccard, double lcs, double levenshtein) {
        return (jaccard * jaccardWeight) +
                (lcs * lcsWeight) +
                (levenshtein * levenshteinWeight);
    }
}
