package com.raditha.metaast.similarity;

import com.raditha.metaast.fingerprint.Token;

import java.util.List;

/**
 * Base for the order-sensitive metrics. Empty input scores 0.0; otherwise the
 * sequences are handed over shorter first, so a single DP row of
 * {@code shorter.size() + 1} cells is enough.
 */
abstract class SequenceSimilarity implements SimilarityStrategy {

    @Override
    public double calculate(List<Token> tokens1, List<Token> tokens2) {
        if (tokens1 == null || tokens2 == null || tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }
        boolean firstShorter = tokens1.size() <= tokens2.size();
        List<Token> shorter = firstShorter ? tokens1 : tokens2;
        List<Token> longer = firstShorter ? tokens2 : tokens1;
        return score(shorter, longer);
    }

    /**
     * @param shorter the shorter sequence, never empty
     * @param longer  the other sequence
     * @return score between 0.0 and 1.0
     */
    abstract double score(List<Token> shorter, List<Token> longer);
}
