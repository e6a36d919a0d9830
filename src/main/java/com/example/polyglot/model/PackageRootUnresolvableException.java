package com.example.polyglot.model;

/**
 * The module-path strategy has no usable base directory to resolve occurrences against.
 */
public class PackageRootUnresolvableException extends CatalogException {

    public PackageRootUnresolvableException(String message) {
        super(message);
    }
}
