package com.raditha.metaast.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A constant value together with its subtype.
 *
 * @param type  the literal subtype
 * @param value the raw value, {@code null} only for {@link LiteralType#NULL}
 * @param meta  node metadata
 */
public record Literal(LiteralType type, @Nullable Object value, NodeMeta meta) implements MetaNode {

    public Literal {
        meta = NodeMeta.orEmpty(meta);
    }

    public Literal(LiteralType type, @Nullable Object value) {
        this(type, value, NodeMeta.EMPTY);
    }

    public static Literal integer(long value) {
        return new Literal(LiteralType.INTEGER, value);
    }

    public static Literal decimal(double value) {
        return new Literal(LiteralType.FLOAT, value);
    }

    public static Literal string(String value) {
        return new Literal(LiteralType.STRING, value);
    }

    public static Literal bool(boolean value) {
        return new Literal(LiteralType.BOOLEAN, value);
    }

    public static Literal nil() {
        return new Literal(LiteralType.NULL, null);
    }

    public static Literal symbol(String value) {
        return new Literal(LiteralType.SYMBOL, value);
    }

    /**
     * Render the value the same way regardless of the originating language.
     */
    public String render() {
        if (type == LiteralType.NULL || value == null) {
            return "null";
        }
        return switch (type) {
            case STRING -> "\"" + value.toString().replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
            case SYMBOL -> ":" + value;
            case REGEX -> "~r/" + value + "/";
            default -> String.valueOf(value);
        };
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LITERAL;
    }

    @Override
    public List<MetaNode> children() {
        return List.of();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
