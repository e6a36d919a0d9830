package com.example.polyglot.model;

public class CatalogPersistenceException extends CatalogException {

    public CatalogPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
