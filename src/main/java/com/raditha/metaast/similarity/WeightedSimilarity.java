package com.raditha.metaast.similarity;

import com.raditha.metaast.config.SimilarityWeights;
import com.raditha.metaast.fingerprint.Token;

import java.util.List;

/**
 * Combines Jaccard, LCS and Levenshtein scores using configurable weights.
 */
public class WeightedSimilarity implements SimilarityStrategy {

    private final JaccardSimilarity jaccard = new JaccardSimilarity();
    private final LCSSimilarity lcs = new LCSSimilarity();
    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();
    private final SimilarityWeights weights;

    public WeightedSimilarity(SimilarityWeights weights) {
        this.weights = weights;
    }

    @Override
    public double calculate(List<Token> tokens1, List<Token> tokens2) {
        double jaccardScore = jaccard.calculate(tokens1, tokens2);
        double lcsScore = lcs.calculate(tokens1, tokens2);
        double levenshteinScore = levenshtein.calculate(tokens1, tokens2);
        return weights.combine(jaccardScore, lcsScore, levenshteinScore);
    }

    public SimilarityWeights weights() {
        return weights;
    }
}
