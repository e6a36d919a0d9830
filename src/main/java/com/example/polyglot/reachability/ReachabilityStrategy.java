package com.example.polyglot.reachability;

import com.example.polyglot.model.CatalogEntry;

import java.util.Optional;

/**
 * Decides whether the code or template behind a catalog entry is part of the active
 * application. Answers only "does the code path exist"; whether the entry still needs a
 * translation is checked by the caller.
 */
@FunctionalInterface
public interface ReachabilityStrategy {

    /**
     * @return a label naming what made the entry reachable (module name, help-text key,
     *         template path), or empty if the entry is not reachable
     */
    Optional<String> match(CatalogEntry entry);

    default boolean isReachable(CatalogEntry entry) {
        return match(entry).isPresent();
    }
}
