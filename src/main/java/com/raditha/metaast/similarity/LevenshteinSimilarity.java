package com.raditha.metaast.similarity;

import com.raditha.metaast.fingerprint.Token;

import java.util.List;

/**
 * {@code 1 - editDistance / longerLength} over token labels.
 */
public class LevenshteinSimilarity extends SequenceSimilarity {

    @Override
    double score(List<Token> shorter, List<Token> longer) {
        return 1.0 - (double) distance(shorter, longer) / longer.size();
    }

    int computeEditDistance(List<Token> tokens1, List<Token> tokens2) {
        return tokens1.size() <= tokens2.size() ? distance(tokens1, tokens2) : distance(tokens2, tokens1);
    }

    private static int distance(List<Token> shorter, List<Token> longer) {
        int[] row = new int[shorter.size() + 1];
        for (int i = 0; i < row.length; i++) {
            row[i] = i;
        }
        for (int j = 0; j < longer.size(); j++) {
            Token token = longer.get(j);
            int diagonal = row[0];
            row[0] = j + 1;
            for (int i = 1; i < row.length; i++) {
                int above = row[i];
                row[i] = shorter.get(i - 1).matches(token)
                        ? diagonal
                        : 1 + Math.min(Math.min(above, row[i - 1]), diagonal);
                diagonal = above;
            }
        }
        return row[shorter.size()];
    }
}
