package com.raditha.metaast.document;

import com.raditha.metaast.model.MetaNode;
import com.raditha.metaast.tree.TreeValidator;
import com.raditha.metaast.tree.ValidationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup of language adapters by language tag and file extension.
 * <p>
 * Built once by the caller and passed to whatever needs to dispatch on
 * language; there is no shared global instance.
 */
public final class AdapterRegistry {

    private static final Logger logger = LoggerFactory.getLogger(AdapterRegistry.class);

    private final Map<String, LanguageAdapter> byLanguage;
    private final Map<String, String> byExtension;
    private final TreeValidator validator;

    private AdapterRegistry(Builder builder) {
        this.byLanguage = Collections.unmodifiableMap(new LinkedHashMap<>(builder.byLanguage));
        this.byExtension = Collections.unmodifiableMap(new LinkedHashMap<>(builder.byExtension));
        this.validator = new TreeValidator(builder.validationOptions);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Find the adapter for a language.
     *
     * @throws UnsupportedLanguageException when none is registered
     */
    public LanguageAdapter adapterFor(String language) {
        LanguageAdapter adapter = language == null ? null : byLanguage.get(normalize(language));
        if (adapter == null) {
            throw UnsupportedLanguageException.forLanguage(language);
        }
        return adapter;
    }

    public boolean supports(String language) {
        return language != null && byLanguage.containsKey(normalize(language));
    }

    /**
     * Detect the language of a file from its extension.
     *
     * @throws UnsupportedLanguageException when the extension is unknown
     */
    public String detectLanguage(String fileName) {
        int dot = fileName == null ? -1 : fileName.lastIndexOf('.');
        if (dot < 0) {
            throw UnsupportedLanguageException.forFile(fileName);
        }
        String language = byExtension.get(fileName.substring(dot).toLowerCase(Locale.ROOT));
        if (language == null) {
            throw UnsupportedLanguageException.forFile(fileName);
        }
        return language;
    }

    public Set<String> languages() {
        return byLanguage.keySet();
    }

    /**
     * Map a native tree to a validated document.
     */
    public Document toDocument(String language, Object nativeAst) throws AdapterException {
        LanguageAdapter adapter = adapterFor(language);
        MetaNode tree = adapter.toMeta(nativeAst);
        validator.validate(tree);
        return new Document(tree, adapter.language());
    }

    /**
     * Parse source text and map it to a validated document.
     */
    public Document parse(String language, String source) throws AdapterException {
        LanguageAdapter adapter = adapterFor(language);
        MetaNode tree = adapter.toMeta(adapter.parse(source));
        validator.validate(tree);
        Map<String, Object> metadata = Map.of(Document.LINE_COUNT, (int) source.lines().count());
        logger.debug("Parsed {} source into tree", adapter.language());
        return new Document(tree, adapter.language(), metadata, source);
    }

    /**
     * Turn a tree back into source text of the given language.
     */
    public String unparse(String language, MetaNode tree) throws AdapterException {
        LanguageAdapter adapter = adapterFor(language);
        return adapter.unparse(adapter.fromMeta(tree));
    }

    private static String normalize(String language) {
        return language.toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<String, LanguageAdapter> byLanguage = new LinkedHashMap<>();
        private final Map<String, String> byExtension = new LinkedHashMap<>();
        private ValidationOptions validationOptions = ValidationOptions.defaults();

        private Builder() {
        }

        public Builder register(LanguageAdapter adapter) {
            String language = normalize(adapter.language());
            byLanguage.put(language, adapter);
            for (String extension : adapter.fileExtensions()) {
                byExtension.put(extension.toLowerCase(Locale.ROOT), language);
            }
            return this;
        }

        public Builder validation(ValidationOptions options) {
            this.validationOptions = options;
            return this;
        }

        public AdapterRegistry build() {
            return new AdapterRegistry(this);
        }
    }
}
