package com.example.polyglot.model;

/**
 * Source location recorded for a catalog entry by the extraction tooling ({@code #: path:line}).
 *
 * @param path source path as written in the catalog, usually relative to the package root
 * @param line line number, or {@code null} when the reference carries none
 */
public record Occurrence(
        String path,
        Integer line
) {
    public Occurrence {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Occurrence path must not be blank");
        }
    }

    /**
     * Parses a single reference token such as {@code lino/modules/foo.py:42}.
     * Only a trailing all-digit segment is treated as the line number.
     */
    public static Occurrence parse(String reference) {
        int colon = reference.lastIndexOf(':');
        if (colon > 0 && colon < reference.length() - 1) {
            String tail = reference.substring(colon + 1);
            if (tail.chars().allMatch(Character::isDigit)) {
                return new Occurrence(reference.substring(0, colon), Integer.valueOf(tail));
            }
        }
        return new Occurrence(reference, null);
    }

    public String toReference() {
        return line != null ? path + ":" + line : path;
    }
}
