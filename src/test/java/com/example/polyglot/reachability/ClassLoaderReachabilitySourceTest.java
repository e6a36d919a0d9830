package com.example.polyglot.reachability;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClassLoaderReachabilitySourceTest {

    private final ClassLoaderReachabilitySource source =
            new ClassLoaderReachabilitySource(getClass().getClassLoader());

    @Test
    void loadableClassIsKnown() {
        assertTrue(source.isKnown("java.util.Map"));
        assertTrue(source.isKnown("com.example.polyglot.reachability.DottedPathResolver"));
        assertFalse(source.isKnown("com.example.polyglot.NoSuchThing"));
    }

    @Test
    void classAttributesAreNestedClassesFieldsAndMethods() {
        ReachableHandle map = source.lookup("java.util.Map").orElseThrow();
        assertTrue(map.attribute("Entry").isPresent());
        assertTrue(map.attribute("get").isPresent());
        assertTrue(map.attribute("noSuchMember").isEmpty());
    }

    @Test
    void packagesAndTheirParentsAreKnown() {
        assertTrue(source.isKnown("com.example.polyglot.reachability"));
        assertTrue(source.isKnown("com.example"));
    }

    @Test
    void dottedPathsWalkFromPackagesIntoClasses() {
        DottedPathResolver resolver = new DottedPathResolver(source);
        assertTrue(resolver.resolveLeftToRight("com.example.polyglot.reachability.ReachabilityMode.MODULES").isPresent());
        assertTrue(resolver.resolveByLongestPrefix("java.util.Map.Entry.getKey").isPresent());
        assertTrue(resolver.resolveByLongestPrefix("java.util.Map.Entry.nothing").isEmpty());
    }
}
