package com.example.polyglot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for catalog extraction and merge.
 */
@ConfigurationProperties(prefix = "polyglot")
public record PolyglotProperties(
        Locale locale,
        Extraction extraction
) {

    public PolyglotProperties {
        if (locale == null) locale = new Locale(null, null);
        if (extraction == null) extraction = new Extraction(null, null, 0);
    }

    /**
     * Where catalogs live below a locale root: {@code locale/<lang>/LC_MESSAGES/<domain>.po}.
     *
     * @param domain          gettext domain, i.e. the catalog file name without extension
     * @param defaultLanguage language used when a command does not name one
     */
    public record Locale(String domain, String defaultLanguage) {
        public Locale {
            if (domain == null || domain.isBlank()) domain = "django";
            if (defaultLanguage == null || defaultLanguage.isBlank()) defaultLanguage = "bn";
        }
    }

    /**
     * @param sourceSuffix   extension stripped when mapping source files to module names
     * @param templateSuffix extension identifying template sources
     * @param previewLength  characters of a msgid shown in progress lines
     */
    public record Extraction(String sourceSuffix, String templateSuffix, int previewLength) {
        public Extraction {
            if (sourceSuffix == null || sourceSuffix.isBlank()) sourceSuffix = ".py";
            if (templateSuffix == null || templateSuffix.isBlank()) templateSuffix = ".html";
            if (previewLength <= 0) previewLength = 50;
        }
    }

    public static PolyglotProperties defaults() {
        return new PolyglotProperties(null, null);
    }
}
