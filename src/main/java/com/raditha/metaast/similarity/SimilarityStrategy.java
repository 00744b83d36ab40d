package com.raditha.metaast.similarity;

import com.raditha.metaast.fingerprint.Token;

import java.util.List;

/**
 * Scores how alike two token sequences are.
 * Implementations return a value in [0, 1] and 0.0 when either side is empty.
 */
@FunctionalInterface
public interface SimilarityStrategy {

    double calculate(List<Token> tokens1, List<Token> tokens2);
}
