package com.raditha.metaast.similarity;

import com.raditha.metaast.fingerprint.Token;

import java.util.List;

/**
 * Longest common subsequence of token labels over the longer length.
 */
public class LCSSimilarity extends SequenceSimilarity {

    @Override
    double score(List<Token> shorter, List<Token> longer) {
        return (double) commonLength(shorter, longer) / longer.size();
    }

    private static int commonLength(List<Token> shorter, List<Token> longer) {
        int[] row = new int[shorter.size() + 1];
        for (Token token : longer) {
            int diagonal = 0;
            for (int i = 1; i < row.length; i++) {
                int above = row[i];
                row[i] = shorter.get(i - 1).matches(token)
                        ? diagonal + 1
                        : Math.max(row[i - 1], above);
                diagonal = above;
            }
        }
        return row[shorter.size()];
    }
}
