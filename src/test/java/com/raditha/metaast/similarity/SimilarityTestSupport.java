package com.raditha.metaast.similarity;

import com.raditha.metaast.fingerprint.Token;
import com.raditha.metaast.model.NodeKind;

import java.util.ArrayList;
import java.util.List;

final class SimilarityTestSupport {

    private SimilarityTestSupport() {
    }

    /**
     * One variable token per label, enough for scoring which only looks at labels.
     */
    static List<Token> tokens(String... labels) {
        List<Token> tokens = new ArrayList<>();
        for (String label : labels) {
            tokens.add(new Token(NodeKind.VARIABLE, label));
        }
        return tokens;
    }
}
