package com.raditha.metaast.similarity;

import com.raditha.metaast.config.SimilarityWeights;

import java.util.Locale;

/**
 * Selectable token similarity algorithms.
 */
public enum SimilarityMetric {
    JACCARD,
    LCS,
    LEVENSHTEIN,
    WEIGHTED;

    public SimilarityStrategy create(SimilarityWeights weights) {
        return switch (this) {
            case JACCARD -> new JaccardSimilarity();
            case LCS -> new LCSSimilarity();
            case LEVENSHTEIN -> new LevenshteinSimilarity();
            case WEIGHTED -> new WeightedSimilarity(weights);
        };
    }

    /**
     * Look up a metric by case-insensitive name.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static SimilarityMetric fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown similarity metric: " + name, e);
        }
    }
}
