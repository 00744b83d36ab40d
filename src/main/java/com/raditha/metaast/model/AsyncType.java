package com.raditha.metaast.model;

import java.util.Locale;

public enum AsyncType {
    AWAIT,
    ASYNC;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
