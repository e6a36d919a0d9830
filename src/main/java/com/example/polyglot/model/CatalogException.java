package com.example.polyglot.model;

/**
 * Base type for failures that abort a catalog operation.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
