package com.example.polyglot.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory translation catalog for one target language.
 * <p>
 * Entries keep the order in which they were loaded. The header entry (empty msgid), when
 * present, is part of the entry list but never returned by {@link #find(String)} and never
 * counted as translatable.
 */
public class Catalog implements Iterable<CatalogEntry> {

    private static final Pattern NPLURALS = Pattern.compile("nplurals\\s*=\\s*(\\d+)");
    private static final int DEFAULT_PLURAL_FORMS = 2;

    private final List<CatalogEntry> entries = new ArrayList<>();
    private final List<String> obsoleteLines = new ArrayList<>();

    public void add(CatalogEntry entry) {
        entries.add(entry);
    }

    public List<CatalogEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    @Override
    public Iterator<CatalogEntry> iterator() {
        return entries().iterator();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Exact, case-sensitive lookup by msgid. Returns the first matching non-header entry.
     */
    public Optional<CatalogEntry> find(String msgid) {
        if (msgid == null) {
            return Optional.empty();
        }
        for (CatalogEntry entry : entries) {
            if (!entry.isHeader() && entry.getMsgid().equals(msgid)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public Optional<CatalogEntry> header() {
        return entries.stream().filter(CatalogEntry::isHeader).findFirst();
    }

    /** Header fields ({@code Content-Type}, {@code Plural-Forms}, ...) in declaration order. */
    public Map<String, String> metadata() {
        Map<String, String> metadata = new LinkedHashMap<>();
        header().ifPresent(h -> {
            for (String line : h.getMsgstr().split("\n")) {
                int colon = line.indexOf(':');
                if (colon > 0) {
                    metadata.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
                }
            }
        });
        return metadata;
    }

    public int pluralFormCount() {
        String pluralForms = metadata().get("Plural-Forms");
        if (pluralForms != null) {
            Matcher m = NPLURALS.matcher(pluralForms);
            if (m.find()) {
                return Integer.parseInt(m.group(1));
            }
        }
        return DEFAULT_PLURAL_FORMS;
    }

    /** Charset declared in the header {@code Content-Type}, defaulting to UTF-8. */
    public String charset() {
        String contentType = metadata().getOrDefault("Content-Type", "");
        int idx = contentType.toLowerCase().indexOf("charset=");
        if (idx >= 0) {
            String value = contentType.substring(idx + "charset=".length()).trim();
            if (!value.isEmpty() && !"CHARSET".equals(value)) {
                return value;
            }
        }
        return "UTF-8";
    }

    /** Obsolete ({@code #~}) lines, preserved verbatim including the marker. */
    public List<String> obsoleteLines() {
        return obsoleteLines;
    }
}
