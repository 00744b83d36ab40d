package com.raditha.metaast.report;

/**
 * Output formats shared by all reporters.
 */
public enum ReportFormat {
    TEXT,
    JSON,
    DETAILED;

    /**
     * Resolve a format by name, ignoring case.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static ReportFormat fromName(String name) {
        for (ReportFormat format : values()) {
            if (format.name().equalsIgnoreCase(name)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown report format: " + name);
    }
}
