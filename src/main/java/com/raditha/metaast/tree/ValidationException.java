package com.raditha.metaast.tree;

import com.raditha.metaast.model.MetaNode;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when a tree fails validation. No partial result accompanies it.
 */
public class ValidationException extends RuntimeException {

    private final ValidationError error;
    private final int actual;
    private final int limit;
    private final transient @Nullable MetaNode node;

    public ValidationException(ValidationError error, String message, @Nullable MetaNode node) {
        this(error, message, -1, -1, node);
    }

    public ValidationException(ValidationError error, String message, int actual, int limit, @Nullable MetaNode node) {
        super(message);
        this.error = error;
        this.actual = actual;
        this.limit = limit;
        this.node = node;
    }

    public static ValidationException invalidStructure(MetaNode node, String detail) {
        return new ValidationException(ValidationError.INVALID_STRUCTURE,
                "Invalid " + node.kind().tag() + " node: " + detail, node);
    }

    public static ValidationException maxDepthExceeded(int actual, int limit) {
        return new ValidationException(ValidationError.MAX_DEPTH_EXCEEDED,
                String.format("Tree depth %d exceeds limit %d", actual, limit), actual, limit, null);
    }

    public static ValidationException tooManyVariables(int actual, int limit) {
        return new ValidationException(ValidationError.TOO_MANY_VARIABLES,
                String.format("Tree references %d variables, limit is %d", actual, limit), actual, limit, null);
    }

    public static ValidationException nativeConstructsNotAllowed(int count) {
        return new ValidationException(ValidationError.NATIVE_CONSTRUCTS_NOT_ALLOWED,
                count + " language-specific construct(s) not allowed in strict mode", count, 0, null);
    }

    public ValidationError error() {
        return error;
    }

    /**
     * Measured value for limit errors, -1 otherwise.
     */
    public int actual() {
        return actual;
    }

    /**
     * Configured limit for limit errors, -1 otherwise.
     */
    public int limit() {
        return limit;
    }

    /**
     * The offending node for structural errors.
     */
    public @Nullable MetaNode node() {
        return node;
    }
}
