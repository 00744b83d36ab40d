package com.raditha.metaast.tree;

/**
 * How strictly a tree is checked.
 */
public enum ValidationMode {
    /** Reject trees containing native escape nodes. */
    STRICT,
    /** Accept native nodes with a warning. */
    STANDARD,
    /** Accept native nodes with a warning; only shape and hard limits are enforced. */
    PERMISSIVE
}
