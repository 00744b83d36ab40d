package com.raditha.metaast.fingerprint;

import com.raditha.metaast.model.*;

/**
 * Symbolic label of one node, free of identifier names and literal values.
 * Token sequences are what near-miss clone detection compares.
 *
 * @param kind  node kind
 * @param label kind tag plus structural tags, e.g. {@code binary_op:arithmetic:+}
 */
public record Token(NodeKind kind, String label) {

    /**
     * Build the token for a node.
     */
    public static Token of(MetaNode node) {
        return new Token(node.kind(), labelOf(node));
    }

    /**
     * Two tokens match when their labels are equal.
     */
    public boolean matches(Token other) {
        return other != null && label.equals(other.label);
    }

    private static String labelOf(MetaNode node) {
        String tag = node.kind().tag();
        return switch (node.kind()) {
            case LITERAL -> tag + ":" + tagOf(((Literal) node).type());
            case BINARY_OP -> {
                BinaryOp op = (BinaryOp) node;
                yield tag + ":" + tagOf(op.category()) + ":" + op.operator();
            }
            case UNARY_OP -> {
                UnaryOp op = (UnaryOp) node;
                yield tag + ":" + tagOf(op.category()) + ":" + op.operator();
            }
            case LOOP -> tag + ":" + tagOf(((Loop) node).type());
            case COLLECTION_OP -> tag + ":" + tagOf(((CollectionOp) node).type());
            case ASYNC_OPERATION -> tag + ":" + tagOf(((AsyncOperation) node).type());
            case CONTAINER -> tag + ":" + tagOf(((Container) node).type());
            case FUNCTION_DEF -> tag + ":" + ((FunctionDef) node).visibility().tag();
            case AUGMENTED_ASSIGNMENT -> tag + ":" + ((AugmentedAssignment) node).operator();
            case LANGUAGE_SPECIFIC -> tag + ":" + ((LanguageSpecific) node).hint();
            default -> tag;
        };
    }

    private static String tagOf(Enum<?> value) {
        return value == null ? "?" : value.name().toLowerCase(java.util.Locale.ROOT);
    }

    @Override
    public String toString() {
        return label;
    }
}
