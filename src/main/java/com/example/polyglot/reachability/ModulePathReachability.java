package com.example.polyglot.reachability;

import com.example.polyglot.model.CatalogEntry;
import com.example.polyglot.model.Occurrence;
import com.example.polyglot.model.PackageRootUnresolvableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reachable when a recorded source file maps to a module known to the {@link ReachabilitySource}.
 * <p>
 * Each occurrence path is resolved against the package root (the directory holding the
 * top-level package), converted to a dotted module name and resolved with
 * {@link DottedPathResolver#resolveByLongestPrefix(String)}. Occurrences whose file does not
 * exist are skipped. The first matching occurrence wins.
 */
public final class ModulePathReachability implements ReachabilityStrategy {

    private static final Logger log = LoggerFactory.getLogger(ModulePathReachability.class);

    public static final String DEFAULT_SOURCE_SUFFIX = ".py";

    private final Path packageRoot;
    private final DottedPathResolver resolver;
    private final String sourceSuffix;

    public ModulePathReachability(Path packageRoot, ReachabilitySource source) {
        this(packageRoot, source, DEFAULT_SOURCE_SUFFIX);
    }

    public ModulePathReachability(Path packageRoot, ReachabilitySource source, String sourceSuffix) {
        if (packageRoot == null) {
            throw new PackageRootUnresolvableException("No package root given for module-path reachability");
        }
        if (!Files.isDirectory(packageRoot)) {
            throw new PackageRootUnresolvableException("Package root is not a directory: " + packageRoot);
        }
        this.packageRoot = packageRoot.toAbsolutePath().normalize();
        this.resolver = new DottedPathResolver(source);
        this.sourceSuffix = Objects.requireNonNull(sourceSuffix, "sourceSuffix cannot be null");
    }

    @Override
    public Optional<String> match(CatalogEntry entry) {
        for (Occurrence occurrence : entry.getOccurrences()) {
            Optional<Path> file = resolveFile(occurrence);
            if (file.isEmpty()) {
                continue;
            }
            String moduleName = moduleName(file.get());
            log.debug("Resolved {} to module {}", occurrence.path(), moduleName);
            if (resolver.resolveByLongestPrefix(moduleName).isPresent()) {
                return Optional.of(moduleName);
            }
        }
        return Optional.empty();
    }

    private Optional<Path> resolveFile(Occurrence occurrence) {
        Path file;
        try {
            file = Path.of(occurrence.path().replace('\\', '/'));
        } catch (InvalidPathException e) {
            log.warn("Invalid source path '{}', skipping occurrence: {}", occurrence.path(), e.getMessage());
            return Optional.empty();
        }
        if (!file.isAbsolute()) {
            file = packageRoot.resolve(file);
        }
        file = file.normalize();
        if (!Files.exists(file)) {
            log.warn("File {} does not exist, skipping occurrence.", file);
            return Optional.empty();
        }
        return Optional.of(file);
    }

    /**
     * Dotted module name for a source file: relative to the package root with the source
     * suffix removed, or the bare file stem when the file lies outside the root.
     */
    String moduleName(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        String fileName = absolute.getFileName() != null ? absolute.getFileName().toString() : "";
        String withoutSuffix = fileName.endsWith(sourceSuffix)
                ? fileName.substring(0, fileName.length() - sourceSuffix.length())
                : fileName;

        if (absolute.startsWith(packageRoot) && !absolute.equals(packageRoot)) {
            Path relative = packageRoot.relativize(absolute);
            List<String> parts = new ArrayList<>();
            for (Path part : relative) {
                parts.add(part.toString());
            }
            parts.set(parts.size() - 1, withoutSuffix);
            return String.join(".", parts);
        }

        // best effort: names may collide across packages
        int dot = withoutSuffix.lastIndexOf('.');
        return dot > 0 ? withoutSuffix.substring(0, dot) : withoutSuffix;
    }
}
