package com.example.polyglot.catalog;

import com.example.polyglot.model.Catalog;

import java.nio.file.Path;

/**
 * Loads and persists catalogs in their textual and compiled binary forms.
 */
public interface CatalogStore {

    /**
     * @throws com.example.polyglot.model.CatalogNotFoundException if the file does not exist
     * @throws com.example.polyglot.model.CatalogParseException    if the content is malformed
     */
    Catalog load(Path path);

    /**
     * Replaces the textual catalog at {@code path}. On failure the previous file is left intact.
     *
     * @throws com.example.polyglot.model.CatalogPersistenceException if writing fails
     */
    void save(Catalog catalog, Path path);

    /**
     * Writes the binary lookup table next to the textual catalog, with its extension replaced.
     *
     * @return path of the written binary file
     * @throws com.example.polyglot.model.CatalogPersistenceException if writing fails
     */
    Path compileBinary(Catalog catalog, Path catalogPath);

    /**
     * Saves the textual catalog together with its binary table. Both are rendered before
     * anything is written; if a write fails the textual catalog is left intact.
     *
     * @return path of the written binary file
     * @throws com.example.polyglot.model.CatalogPersistenceException if writing fails
     */
    Path saveCompiled(Catalog catalog, Path catalogPath);
}
