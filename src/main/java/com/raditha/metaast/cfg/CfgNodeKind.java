package com.raditha.metaast.cfg;

import java.util.Locale;

public enum CfgNodeKind {
    ENTRY,
    EXIT,
    STATEMENT,
    CONDITIONAL,
    LOOP;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
