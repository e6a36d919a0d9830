package com.example.polyglot.reachability;

import com.example.polyglot.model.CatalogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reachable when the entry's msgid is the text registered under a dotted symbol key
 * (e.g. {@code lino.modules.contacts.Partner.name}) and that key resolves against the
 * {@link ReachabilitySource}, walking left to right.
 * <p>
 * Keys are resolved once at construction; when several resolving keys share a text, the first
 * one in map order is reported.
 */
public final class DottedSymbolReachability implements ReachabilityStrategy {

    private static final Logger log = LoggerFactory.getLogger(DottedSymbolReachability.class);

    private final Map<String, String> keyByText;

    public DottedSymbolReachability(Map<String, String> textsByKey, ReachabilitySource source) {
        Objects.requireNonNull(textsByKey, "textsByKey cannot be null");
        DottedPathResolver resolver = new DottedPathResolver(source);
        this.keyByText = new LinkedHashMap<>();
        int resolved = 0;
        for (Map.Entry<String, String> item : textsByKey.entrySet()) {
            if (item.getValue() == null) {
                continue;
            }
            if (resolver.resolveLeftToRight(item.getKey()).isPresent()) {
                resolved++;
                keyByText.putIfAbsent(item.getValue(), item.getKey());
            } else {
                log.debug("Symbol {} is not loaded", item.getKey());
            }
        }
        log.info("{}/{} symbol keys resolved", resolved, textsByKey.size());
    }

    @Override
    public Optional<String> match(CatalogEntry entry) {
        return Optional.ofNullable(keyByText.get(entry.getMsgid()));
    }
}
