package com.example.polyglot.model;

/**
 * Malformed catalog text. The line number is 1-based.
 */
public class CatalogParseException extends CatalogException {

    private final int lineNumber;

    public CatalogParseException(String source, int lineNumber, String message) {
        super("%s:%d: %s".formatted(source, lineNumber, message));
        this.lineNumber = lineNumber;
    }

    public CatalogParseException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = -1;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
