package com.raditha.metaast.complexity;

/**
 * Line counts. Only {@code logical} is measured; the others come from the
 * caller's metadata.
 */
public record LocMetrics(int physical, int logical, int comments, int blank) {

    /**
     * Build line counts, defaulting physical lines to the logical count and
     * comments to zero.
     */
    public static LocMetrics of(int logical, Integer physical, Integer comments) {
        int p = physical == null ? logical : physical;
        int c = comments == null ? 0 : comments;
        return new LocMetrics(p, logical, c, Math.max(0, p - logical - c));
    }

    public LocMetrics plus(LocMetrics other) {
        return new LocMetrics(
                physical + other.physical,
                logical + other.logical,
                comments + other.comments,
                blank + other.blank);
    }
}
