package com.raditha.metaast.tree;

/**
 * Non-fatal finding attached to a validation report.
 *
 * @param type    warning type
 * @param message human readable description
 */
public record ValidationWarning(Type type, String message) {

    public enum Type {
        NATIVE_CONSTRUCTS_PRESENT,
        DEEP_NESTING,
        LARGE_AST
    }
}
