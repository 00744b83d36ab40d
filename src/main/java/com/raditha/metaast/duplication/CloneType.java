package com.raditha.metaast.duplication;

/**
 * Clone classification, from the strongest match to none.
 */
public enum CloneType {
    TYPE_I("Type I", "Exact Clone"),
    TYPE_II("Type II", "Renamed Clone"),
    TYPE_III("Type III", "Near-Miss Clone"),
    TYPE_IV("Type IV", "Semantic Clone"),
    NONE("None", "No Clone");

    private final String label;
    private final String description;

    CloneType(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    /**
     * Label with description, e.g. {@code Type I (Exact Clone)}.
     */
    public String displayName() {
        return label + " (" + description + ")";
    }

    public boolean isClone() {
        return this != NONE;
    }
}
