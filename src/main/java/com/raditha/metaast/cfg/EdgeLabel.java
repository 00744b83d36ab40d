package com.raditha.metaast.cfg;

import java.util.Locale;

/**
 * Why control passes along an edge.
 */
public enum EdgeLabel {
    SEQUENTIAL,
    THEN,
    ELSE,
    BODY,
    LOOP_BACK,
    EXIT,
    EXCEPTION,
    ARM,
    RETURN;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
