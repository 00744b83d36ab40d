package com.raditha.metaast.model;

import java.util.Locale;

/**
 * Kind of loop. A {@link #WHILE} loop is driven by a condition, the others by
 * an iterator over a collection.
 */
public enum LoopType {
    WHILE,
    FOR,
    FOR_EACH;

    public boolean isConditional() {
        return this == WHILE;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
