package com.raditha.metaast.model;

import java.util.Locale;

/**
 * Category of a unary or binary operator.
 */
public enum OperatorCategory {
    ARITHMETIC,
    COMPARISON,
    BOOLEAN;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
