package com.example.polyglot.reachability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * {@link ReachabilitySource} for JVM host applications.
 * <p>
 * A dotted name is known when it names a class that the class loader can load (classes are
 * not initialized) or a package defined in that loader or its ancestors, including the parent
 * packages of those. Attributes of a class are its nested classes, fields and methods;
 * attributes of a package are the classes and sub-packages beneath it.
 */
public final class ClassLoaderReachabilitySource implements ReachabilitySource {

    private static final Logger log = LoggerFactory.getLogger(ClassLoaderReachabilitySource.class);

    private final ClassLoader classLoader;
    private final NavigableSet<String> packageNames;

    public ClassLoaderReachabilitySource(ClassLoader classLoader) {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader cannot be null");
        this.packageNames = new TreeSet<>();
        Arrays.stream(classLoader.getDefinedPackages()).map(Package::getName).forEach(packageNames::add);
        Arrays.stream(Package.getPackages()).map(Package::getName).forEach(packageNames::add);
    }

    public static ClassLoaderReachabilitySource ofContextClassLoader() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        return new ClassLoaderReachabilitySource(
                loader != null ? loader : ClassLoaderReachabilitySource.class.getClassLoader());
    }

    @Override
    public Optional<ReachableHandle> lookup(String dottedName) {
        if (dottedName == null || dottedName.isBlank()) {
            return Optional.empty();
        }
        Optional<Class<?>> type = loadClass(dottedName);
        if (type.isPresent()) {
            return Optional.of(new ClassHandle(type.get()));
        }
        if (isPackage(dottedName)) {
            return Optional.of(new PackageHandle(dottedName));
        }
        return Optional.empty();
    }

    private boolean isPackage(String name) {
        if (packageNames.contains(name)) {
            return true;
        }
        String prefix = name + ".";
        String next = packageNames.ceiling(prefix);
        return next != null && next.startsWith(prefix);
    }

    private Optional<Class<?>> loadClass(String name) {
        try {
            return Optional.of(Class.forName(name, false, classLoader));
        } catch (ClassNotFoundException e) {
            return Optional.empty();
        } catch (LinkageError e) {
            log.debug("Class {} is present but cannot be linked: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    private final class PackageHandle implements ReachableHandle {

        private final String name;

        private PackageHandle(String name) {
            this.name = name;
        }

        @Override
        public Optional<ReachableHandle> attribute(String attribute) {
            return lookup(name + "." + attribute);
        }
    }

    private static final class ClassHandle implements ReachableHandle {

        private final Class<?> type;

        private ClassHandle(Class<?> type) {
            this.type = type;
        }

        @Override
        public Optional<ReachableHandle> attribute(String attribute) {
            try {
                for (Class<?> nested : type.getDeclaredClasses()) {
                    if (nested.getSimpleName().equals(attribute)) {
                        return Optional.of(new ClassHandle(nested));
                    }
                }
                for (Field field : type.getDeclaredFields()) {
                    if (field.getName().equals(attribute)) {
                        return Optional.of(new ClassHandle(field.getType()));
                    }
                }
                for (Method method : type.getMethods()) {
                    if (method.getName().equals(attribute)) {
                        return Optional.of(new ClassHandle(method.getReturnType()));
                    }
                }
            } catch (LinkageError e) {
                log.debug("Cannot introspect {} for attribute '{}': {}", type.getName(), attribute, e.getMessage());
            }
            return Optional.empty();
        }
    }
}
