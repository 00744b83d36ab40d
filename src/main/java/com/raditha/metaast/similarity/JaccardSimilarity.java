package com.raditha.metaast.similarity;

import com.raditha.metaast.fingerprint.Token;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Multiset Jaccard similarity over token labels.
 * Order insensitive: {@code sum(min(countA, countB)) / sum(max(countA, countB))}
 * over every label.
 */
public class JaccardSimilarity implements SimilarityStrategy {

    @Override
    public double calculate(List<Token> tokens1, List<Token> tokens2) {
        if (tokens1 == null || tokens2 == null || tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        Map<String, Integer> counts1 = countLabels(tokens1);
        Map<String, Integer> counts2 = countLabels(tokens2);

        Set<String> labels = new HashSet<>(counts1.keySet());
        labels.addAll(counts2.keySet());

        int intersection = 0;
        int union = 0;
        for (String label : labels) {
            int a = counts1.getOrDefault(label, 0);
            int b = counts2.getOrDefault(label, 0);
            intersection += Math.min(a, b);
            union += Math.max(a, b);
        }

        if (union == 0) {
            return 0.0;
        }
        return (double) intersection / union;
    }

    private Map<String, Integer> countLabels(List<Token> tokens) {
        Map<String, Integer> counts = new HashMap<>();
        for (Token token : tokens) {
            counts.merge(token.label(), 1, Integer::sum);
        }
        return counts;
    }
}
