package com.raditha.metaast.model;

import java.util.Locale;

/**
 * Kind of a named container of definitions.
 */
public enum ContainerType {
    MODULE,
    CLASS,
    NAMESPACE;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
