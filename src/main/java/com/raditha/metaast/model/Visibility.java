package com.raditha.metaast.model;

import java.util.Locale;

public enum Visibility {
    PUBLIC,
    PRIVATE,
    PROTECTED;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
