package com.raditha.metaast.duplication;

import com.raditha.metaast.document.Document;
import org.jspecify.annotations.Nullable;

import java.util.OptionalInt;

/**
 * Where a compared tree came from. Any part may be unknown.
 */
public record CloneLocation(
        @Nullable String file,
        @Nullable Integer startLine,
        @Nullable Integer endLine,
        String language) {

    /**
     * Take the location from document metadata, falling back to the line
     * hints on the root node.
     */
    public static CloneLocation of(Document document) {
        OptionalInt start = document.startLine();
        if (start.isEmpty()) {
            start = document.ast().meta().line();
        }
        OptionalInt end = document.endLine();
        if (end.isEmpty()) {
            end = document.ast().meta().endLine();
        }
        return new CloneLocation(
                document.file().orElse(null),
                start.isPresent() ? start.getAsInt() : null,
                end.isPresent() ? end.getAsInt() : null,
                document.language());
    }

    /**
     * Compact form {@code file:start-end (language)} with {@code unknown} and
     * {@code ?} for missing parts.
     */
    @Override
    public String toString() {
        return String.format("%s:%s-%s (%s)",
                file == null ? "unknown" : file,
                startLine == null ? "?" : startLine,
                endLine == null ? "?" : endLine,
                language);
    }
}
