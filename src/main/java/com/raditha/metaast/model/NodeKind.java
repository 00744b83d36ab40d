package com.raditha.metaast.model;

import java.util.Locale;

/**
 * The closed set of MetaAST node kinds.
 */
public enum NodeKind {
    LITERAL(Layer.CORE),
    VARIABLE(Layer.CORE),
    LIST(Layer.CORE),
    MAP(Layer.CORE),
    PAIR(Layer.CORE),
    TUPLE(Layer.CORE),
    BINARY_OP(Layer.CORE),
    UNARY_OP(Layer.CORE),
    FUNCTION_CALL(Layer.CORE),
    CONDITIONAL(Layer.CORE),
    EARLY_RETURN(Layer.CORE),
    BLOCK(Layer.CORE),
    ASSIGNMENT(Layer.CORE),
    INLINE_MATCH(Layer.CORE),

    LOOP(Layer.EXTENDED),
    LAMBDA(Layer.EXTENDED),
    COLLECTION_OP(Layer.EXTENDED),
    PATTERN_MATCH(Layer.EXTENDED),
    MATCH_ARM(Layer.EXTENDED),
    EXCEPTION_HANDLING(Layer.EXTENDED),
    ASYNC_OPERATION(Layer.EXTENDED),

    CONTAINER(Layer.STRUCTURAL),
    FUNCTION_DEF(Layer.STRUCTURAL),
    PARAM(Layer.STRUCTURAL),
    ATTRIBUTE_ACCESS(Layer.STRUCTURAL),
    AUGMENTED_ASSIGNMENT(Layer.STRUCTURAL),
    PROPERTY(Layer.STRUCTURAL),

    LANGUAGE_SPECIFIC(Layer.NATIVE);

    private final Layer layer;

    NodeKind(Layer layer) {
        this.layer = layer;
    }

    public Layer layer() {
        return layer;
    }

    /**
     * Lower case tag used in serialized forms, e.g. {@code binary_op}.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
