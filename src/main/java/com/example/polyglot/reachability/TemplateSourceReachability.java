package com.example.polyglot.reachability;

import com.example.polyglot.model.CatalogEntry;
import com.example.polyglot.model.Occurrence;

import java.util.Objects;
import java.util.Optional;

/**
 * Reachable when any recorded source location is a template file. Pure classification over
 * the occurrence paths; no external state is consulted.
 */
public final class TemplateSourceReachability implements ReachabilityStrategy {

    public static final String DEFAULT_SUFFIX = ".html";

    private final String templateSuffix;

    public TemplateSourceReachability() {
        this(DEFAULT_SUFFIX);
    }

    public TemplateSourceReachability(String templateSuffix) {
        this.templateSuffix = Objects.requireNonNull(templateSuffix, "templateSuffix cannot be null");
    }

    @Override
    public Optional<String> match(CatalogEntry entry) {
        return entry.getOccurrences().stream()
                .map(Occurrence::path)
                .filter(path -> path.endsWith(templateSuffix))
                .findFirst();
    }
}
