package com.example.polyglot.model;

import java.nio.file.Path;

public class CatalogNotFoundException extends CatalogException {

    private final Path path;

    public CatalogNotFoundException(Path path) {
        super("Catalog not found: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
