package com.raditha.metaast.document;

/**
 * An analysis that turns a document into a result.
 *
 * @param <R> result type
 */
public interface DocumentAnalyzer<R> {

    R analyze(Document document);

    /**
     * Analyze a native tree directly, mapping it through the registry first.
     *
     * @throws UnsupportedLanguageException when the registry has no adapter for the language
     * @throws AdapterException             when the adapter cannot map the tree
     */
    default R analyze(String language, Object nativeAst, AdapterRegistry registry) throws AdapterException {
        return analyze(registry.toDocument(language, nativeAst));
    }
}
