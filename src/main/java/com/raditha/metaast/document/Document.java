package com.raditha.metaast.document;

import com.raditha.metaast.model.MetaNode;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A tree together with the language it came from and caller supplied metadata.
 *
 * @param ast            the tree
 * @param language       originating language tag, e.g. {@code python}; stored lower case
 * @param metadata       recognized keys are {@value #LINE_COUNT}, {@value #COMMENT_LINES},
 *                       {@value #FILE}, {@value #START_LINE} and {@value #END_LINE}
 * @param originalSource source text when available
 */
public record Document(
        MetaNode ast,
        String language,
        Map<String, Object> metadata,
        @Nullable String originalSource) {

    public static final String LINE_COUNT = "line_count";
    public static final String COMMENT_LINES = "comment_lines";
    public static final String FILE = "file";
    public static final String START_LINE = "start_line";
    public static final String END_LINE = "end_line";

    public static final String UNKNOWN_LANGUAGE = "unknown";

    public Document {
        if (ast == null) {
            throw new IllegalArgumentException("ast cannot be null");
        }
        if (language == null || language.isBlank()) {
            language = UNKNOWN_LANGUAGE;
        } else {
            language = language.trim().toLowerCase(Locale.ROOT);
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Document(MetaNode ast, String language) {
        this(ast, language, Map.of(), null);
    }

    /**
     * Wrap a bare tree with no language and no metadata.
     */
    public static Document of(MetaNode ast) {
        return new Document(ast, UNKNOWN_LANGUAGE);
    }

    public Document withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new Document(ast, language, copy, originalSource);
    }

    public OptionalInt lineCount() {
        return intValue(LINE_COUNT);
    }

    public OptionalInt commentLines() {
        return intValue(COMMENT_LINES);
    }

    public OptionalInt startLine() {
        return intValue(START_LINE);
    }

    public OptionalInt endLine() {
        return intValue(END_LINE);
    }

    public Optional<String> file() {
        Object value = metadata.get(FILE);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    private OptionalInt intValue(String key) {
        Object value = metadata.get(key);
        if (value instanceof Number) {
            return OptionalInt.of(((Number) value).intValue());
        }
        return OptionalInt.empty();
    }
}
