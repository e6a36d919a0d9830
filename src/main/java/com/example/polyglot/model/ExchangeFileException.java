package com.example.polyglot.model;

/**
 * An exchange file (extraction output or translation input) could not be read or written.
 */
public class ExchangeFileException extends CatalogException {

    public ExchangeFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
