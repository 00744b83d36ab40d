package com.raditha.metaast.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Subtype of a literal value.
 */
public enum LiteralType {
    INTEGER,
    FLOAT,
    STRING,
    BOOLEAN,
    NULL,
    SYMBOL,
    REGEX;

    /**
     * Check whether a raw value is acceptable for this subtype.
     */
    public boolean accepts(Object value) {
        return switch (this) {
            case INTEGER -> value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte
                    || value instanceof java.math.BigInteger;
            case FLOAT -> value instanceof Double || value instanceof Float
                    || value instanceof java.math.BigDecimal;
            case STRING, SYMBOL -> value instanceof String;
            case BOOLEAN -> value instanceof Boolean;
            case NULL -> value == null;
            case REGEX -> value instanceof String || value instanceof Pattern;
        };
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
