package com.example.polyglot.model;

/**
 * Outcome counters of one merge run.
 * Re-applying a value identical to the current translation counts in none of the buckets.
 *
 * @param total    number of translation records offered
 * @param updated  entries whose translation changed
 * @param skipped  records ignored because they were empty or did not fit the entry shape
 * @param notFound records whose msgid matched no catalog entry
 */
public record MergeResult(
        int total,
        int updated,
        int skipped,
        int notFound
) {
    public int unchanged() {
        return total - updated - skipped - notFound;
    }
}
