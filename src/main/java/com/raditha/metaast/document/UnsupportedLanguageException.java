package com.raditha.metaast.document;

/**
 * No adapter is registered for a language or file extension.
 */
public class UnsupportedLanguageException extends RuntimeException {

    private final String language;

    public UnsupportedLanguageException(String language, String message) {
        super(message);
        this.language = language;
    }

    public static UnsupportedLanguageException forLanguage(String language) {
        return new UnsupportedLanguageException(language, "No adapter found for language: " + language);
    }

    public static UnsupportedLanguageException forFile(String fileName) {
        return new UnsupportedLanguageException(null, "Unknown file extension: " + fileName);
    }

    /**
     * The requested language, or null when detection from a file name failed.
     */
    public String language() {
        return language;
    }
}
