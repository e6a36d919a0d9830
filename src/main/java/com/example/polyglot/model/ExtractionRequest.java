package com.example.polyglot.model;

import java.nio.file.Path;

/**
 * Parameters of one extraction run.
 *
 * @param localeRoot     directory containing the {@code locale/} tree
 * @param language       target language code, {@code null} for the configured default
 * @param outputFile     exchange file to write, {@code null} for the mode's default name
 * @param packageRoot    directory holding the top-level source package (module mode)
 * @param moduleManifest JSON manifest of loaded modules; {@code null} to inspect the JVM class loader
 * @param symbolTexts    JSON map of dotted symbol keys to texts (help-text mode)
 */
public record ExtractionRequest(
        Path localeRoot,
        String language,
        Path outputFile,
        Path packageRoot,
        Path moduleManifest,
        Path symbolTexts
) {}
