package com.example.polyglot.reachability;

import java.util.Optional;

/**
 * Read-only view of what is currently loaded in the host application.
 * <p>
 * Implementations are passed explicitly to the strategies that need them; nothing in this
 * package consults global state.
 */
@FunctionalInterface
public interface ReachabilitySource {

    /**
     * Looks up a fully loaded unit (module, package, class) by its dotted name.
     *
     * @param dottedName name such as {@code lino.modules.contacts.models}
     * @return a handle for further attribute traversal, or empty if the name is not known
     */
    Optional<ReachableHandle> lookup(String dottedName);

    default boolean isKnown(String dottedName) {
        return lookup(dottedName).isPresent();
    }
}
