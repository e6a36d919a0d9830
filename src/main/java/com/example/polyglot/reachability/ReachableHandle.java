package com.example.polyglot.reachability;

import java.util.Optional;

/**
 * Something resolved through a {@link ReachabilitySource} that may expose named attributes.
 */
@FunctionalInterface
public interface ReachableHandle {

    Optional<ReachableHandle> attribute(String name);
}
