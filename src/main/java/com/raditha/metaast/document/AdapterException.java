package com.raditha.metaast.document;

/**
 * Raised by a {@link LanguageAdapter} when source cannot be parsed or a tree
 * cannot be mapped to or from the native form.
 */
public class AdapterException extends Exception {

    private final String language;

    public AdapterException(String language, String message) {
        super(message);
        this.language = language;
    }

    public AdapterException(String language, String message, Throwable cause) {
        super(message, cause);
        this.language = language;
    }

    public String language() {
        return language;
    }
}
