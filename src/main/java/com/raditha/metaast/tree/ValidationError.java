package com.raditha.metaast.tree;

/**
 * Reasons a tree is rejected outright.
 */
public enum ValidationError {
    INVALID_STRUCTURE,
    MAX_DEPTH_EXCEEDED,
    TOO_MANY_VARIABLES,
    NATIVE_CONSTRUCTS_NOT_ALLOWED
}
