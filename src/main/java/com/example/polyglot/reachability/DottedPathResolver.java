package com.example.polyglot.reachability;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves dotted paths ({@code a.b.c}) against a {@link ReachabilitySource}, combining direct
 * lookups of loaded units with attribute traversal on already resolved handles.
 * <p>
 * Two walk orders are offered:
 * <ul>
 *   <li>{@link #resolveLeftToRight(String)}: for each prefix, direct lookup first, then an
 *       attribute of the previously resolved handle</li>
 *   <li>{@link #resolveByLongestPrefix(String)}: exact lookup, then the longest known prefix
 *       whose remaining segments all resolve as attributes</li>
 * </ul>
 */
public class DottedPathResolver {

    private final ReachabilitySource source;

    public DottedPathResolver(ReachabilitySource source) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
    }

    public Optional<ReachableHandle> resolveLeftToRight(String dottedPath) {
        List<String> segments = segments(dottedPath);
        if (segments.isEmpty()) {
            return Optional.empty();
        }

        ReachableHandle current = null;
        for (int i = 0; i < segments.size(); i++) {
            Optional<ReachableHandle> direct = source.lookup(join(segments, i + 1));
            if (direct.isPresent()) {
                current = direct.get();
                continue;
            }
            if (current == null) {
                return Optional.empty();
            }
            Optional<ReachableHandle> attribute = current.attribute(segments.get(i));
            if (attribute.isEmpty()) {
                return Optional.empty();
            }
            current = attribute.get();
        }
        return Optional.of(current);
    }

    public Optional<ReachableHandle> resolveByLongestPrefix(String dottedPath) {
        List<String> segments = segments(dottedPath);
        if (segments.isEmpty()) {
            return Optional.empty();
        }

        Optional<ReachableHandle> exact = source.lookup(dottedPath);
        if (exact.isPresent()) {
            return exact;
        }

        for (int prefixLength = segments.size() - 1; prefixLength > 0; prefixLength--) {
            Optional<ReachableHandle> prefix = source.lookup(join(segments, prefixLength));
            if (prefix.isEmpty()) {
                continue;
            }
            Optional<ReachableHandle> walked = walkAttributes(prefix.get(), segments, prefixLength);
            if (walked.isPresent()) {
                return walked;
            }
        }
        return Optional.empty();
    }

    private static Optional<ReachableHandle> walkAttributes(ReachableHandle start, List<String> segments, int from) {
        ReachableHandle current = start;
        for (int i = from; i < segments.size(); i++) {
            Optional<ReachableHandle> next = current.attribute(segments.get(i));
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    /** Empty list when the path is blank or has an empty segment. */
    static List<String> segments(String dottedPath) {
        if (dottedPath == null || dottedPath.isBlank()) {
            return List.of();
        }
        List<String> segments = Arrays.asList(dottedPath.split("\\.", -1));
        if (segments.stream().anyMatch(String::isEmpty)) {
            return List.of();
        }
        return segments;
    }

    private static String join(List<String> segments, int length) {
        return String.join(".", segments.subList(0, length));
    }
}
