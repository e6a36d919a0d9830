package com.example.polyglot.catalog;

import com.example.polyglot.config.PolyglotProperties;
import com.example.polyglot.model.CatalogNotFoundException;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Finds the catalog for a language below a locale root:
 * {@code <root>/locale/<lang>/LC_MESSAGES/<domain>.po}.
 */
@Component
public class CatalogLocator {

    private final PolyglotProperties properties;

    public CatalogLocator(PolyglotProperties properties) {
        this.properties = properties;
    }

    public Path catalogPath(Path localeRoot, String language) {
        String lang = language == null || language.isBlank()
                ? properties.locale().defaultLanguage()
                : language;
        return localeRoot.resolve("locale")
                .resolve(lang)
                .resolve("LC_MESSAGES")
                .resolve(properties.locale().domain() + ".po");
    }

    /**
     * @throws CatalogNotFoundException if no catalog exists at the expected location
     */
    public Path locate(Path localeRoot, String language) {
        Path path = catalogPath(localeRoot, language);
        if (!Files.isRegularFile(path)) {
            throw new CatalogNotFoundException(path);
        }
        return path;
    }
}
