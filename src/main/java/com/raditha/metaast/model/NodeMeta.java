package com.raditha.metaast.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Ordered, immutable attribute map attached to every node.
 * Holds source location hints and any extra attributes an adapter wants to
 * preserve. Attribute order only matters for display.
 *
 * @param attributes the attributes in insertion order
 */
public record NodeMeta(Map<String, Object> attributes) {

    public static final String LINE = "line";
    public static final String COLUMN = "col";
    public static final String END_LINE = "end_line";
    public static final String END_COLUMN = "end_col";

    /**
     * Keys describing where a node came from rather than what it is.
     */
    public static final Set<String> LOCATION_KEYS = Set.of(LINE, COLUMN, END_LINE, END_COLUMN);

    public static final NodeMeta EMPTY = new NodeMeta(Map.of());

    public NodeMeta {
        if (attributes == null || attributes.isEmpty()) {
            attributes = Map.of();
        } else {
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }
    }

    /**
     * Substitute {@link #EMPTY} for a missing value.
     */
    public static NodeMeta orEmpty(NodeMeta meta) {
        return meta == null ? EMPTY : meta;
    }

    /**
     * Metadata carrying only a start line.
     */
    public static NodeMeta atLine(int line) {
        return new NodeMeta(Map.of(LINE, line));
    }

    /**
     * Return a copy with one attribute added or replaced.
     */
    public NodeMeta with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return new NodeMeta(copy);
    }

    public Object get(String key) {
        return attributes.get(key);
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    public OptionalInt line() {
        return intValue(LINE);
    }

    public OptionalInt endLine() {
        return intValue(END_LINE);
    }

    private OptionalInt intValue(String key) {
        Object value = attributes.get(key);
        if (value instanceof Number) {
            return OptionalInt.of(((Number) value).intValue());
        }
        return OptionalInt.empty();
    }
}
