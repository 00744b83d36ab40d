package com.raditha.metaast.duplication;

/**
 * Size measures of the first compared tree.
 *
 * @param size      node count
 * @param variables distinct variable and parameter names
 */
public record DuplicationMetrics(int size, int variables) {
}
