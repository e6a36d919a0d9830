package com.example.polyglot.catalog;

import com.example.polyglot.model.Catalog;
import com.example.polyglot.model.CatalogException;
import com.example.polyglot.model.CatalogNotFoundException;
import com.example.polyglot.model.CatalogParseException;
import com.example.polyglot.model.CatalogPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link CatalogStore} for gettext {@code .po} catalogs compiled to {@code .mo}.
 * <p>
 * Catalogs are decoded with the charset declared in their header and encoded with the same
 * one. Files are written to a temporary sibling first and moved into place; the replaced
 * file's POSIX permissions are kept, new files get {@code rw-r--r--}.
 */
@Service
public class PoCatalogStore implements CatalogStore {

    private static final Logger log = LoggerFactory.getLogger(PoCatalogStore.class);

    private static final Pattern HEADER_CHARSET = Pattern.compile("charset=([A-Za-z0-9_.:-]+)");
    private static final Set<PosixFilePermission> NEW_FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private final PoWriter writer = new PoWriter();
    private final MoCompiler compiler = new MoCompiler();

    @Override
    public Catalog load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new CatalogNotFoundException(path);
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new CatalogException("Unable to read catalog " + path + ": " + e.getMessage(), e);
        }
        Charset charset = declaredCharset(bytes, path);
        String text;
        try {
            text = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new CatalogParseException("Catalog is not valid " + charset.name() + ": " + path, e);
        }
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        Catalog catalog = new PoParser(path.toString()).parse(text);
        log.debug("Loaded {} entries from {}", catalog.size(), path);
        return catalog;
    }

    @Override
    public void save(Catalog catalog, Path path) {
        Charset charset = charsetOf(catalog);
        writeAtomically(path, writer.write(catalog).getBytes(charset));
        log.debug("Saved {} entries to {}", catalog.size(), path);
    }

    @Override
    public Path compileBinary(Catalog catalog, Path catalogPath) {
        Path binaryPath = binaryPathFor(catalogPath);
        writeAtomically(binaryPath, compiler.compile(catalog));
        return binaryPath;
    }

    /**
     * Renders both forms before touching the disk, then writes the binary table and finally
     * the textual catalog. A failed write leaves the textual catalog as it was.
     */
    @Override
    public Path saveCompiled(Catalog catalog, Path catalogPath) {
        byte[] text = writer.write(catalog).getBytes(charsetOf(catalog));
        byte[] binary = compiler.compile(catalog);
        Path binaryPath = binaryPathFor(catalogPath);
        writeAtomically(binaryPath, binary);
        writeAtomically(catalogPath, text);
        log.debug("Saved {} entries to {} and {}", catalog.size(), catalogPath, binaryPath);
        return binaryPath;
    }

    /** {@code messages.po} becomes {@code messages.mo}; other names get {@code .mo} appended. */
    public static Path binaryPathFor(Path catalogPath) {
        String name = catalogPath.getFileName().toString();
        String binaryName = name.endsWith(".po")
                ? name.substring(0, name.length() - 3) + ".mo"
                : name + ".mo";
        return catalogPath.resolveSibling(binaryName);
    }

    private static Charset charsetOf(Catalog catalog) {
        try {
            return Charset.forName(catalog.charset());
        } catch (IllegalArgumentException e) {
            log.warn("Unsupported catalog charset '{}', writing UTF-8", catalog.charset());
            return StandardCharsets.UTF_8;
        }
    }

    /**
     * Charset named in the header's {@code Content-Type}. The header is ASCII, so it is read
     * from the bytes before the first blank line without knowing the encoding yet.
     */
    static Charset declaredCharset(byte[] bytes, Path path) {
        String ascii = new String(bytes, StandardCharsets.ISO_8859_1);
        int headerEnd = ascii.indexOf("\n\n");
        if (headerEnd < 0) {
            headerEnd = ascii.indexOf("\r\n\r\n");
        }
        Matcher m = HEADER_CHARSET.matcher(headerEnd < 0 ? ascii : ascii.substring(0, headerEnd));
        if (!m.find() || "CHARSET".equals(m.group(1))) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(m.group(1));
        } catch (IllegalArgumentException e) {
            log.warn("Unsupported charset '{}' declared in {}, reading UTF-8", m.group(1), path);
            return StandardCharsets.UTF_8;
        }
    }

    private static void writeAtomically(Path target, byte[] content) {
        Path directory = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            Files.write(temp, content);
            applyPermissions(temp, target);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            CatalogPersistenceException failure =
                    new CatalogPersistenceException("Unable to write " + target + ": " + e.getMessage(), e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    private static void applyPermissions(Path temp, Path target) throws IOException {
        if (!temp.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.isRegularFile(target)
                ? Files.getPosixFilePermissions(target)
                : NEW_FILE_PERMISSIONS;
        Files.setPosixFilePermissions(temp, permissions);
    }
}
