package com.raditha.metaast.model;

import java.util.Locale;

/**
 * Higher order collection operations.
 */
public enum CollectionOpType {
    MAP,
    FILTER,
    REDUCE,
    EACH,
    FLAT_MAP,
    FIND,
    ANY,
    ALL;

    /**
     * Only a reduction carries an initial accumulator value.
     */
    public boolean takesInitialValue() {
        return this == REDUCE;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
