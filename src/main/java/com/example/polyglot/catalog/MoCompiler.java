package com.example.polyglot.catalog;

import com.example.polyglot.model.Catalog;
import com.example.polyglot.model.CatalogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compiles a catalog to the GNU MO binary lookup format.
 * <p>
 * Layout: little-endian header (magic {@code 0x950412de}, revision 0, string count, offsets
 * of the original and translation tables, empty hash table), both tables of
 * {@code (length, offset)} pairs, then the NUL-terminated strings. Keys are sorted by their
 * encoded bytes so the output is deterministic. The header entry is always included; other
 * entries only when translated and not fuzzy.
 */
public final class MoCompiler {

    private static final Logger log = LoggerFactory.getLogger(MoCompiler.class);

    static final int MAGIC = 0x950412de;
    private static final int HEADER_SIZE = 28;
    private static final String CONTEXT_SEPARATOR = "\u0004";
    private static final String NUL = "\u0000";

    public byte[] compile(Catalog catalog) {
        Charset charset = resolveCharset(catalog.charset());

        Map<byte[], byte[]> messages = new TreeMap<byte[], byte[]>(Arrays::compareUnsigned);
        for (CatalogEntry entry : catalog) {
            if (!entry.isHeader() && (!entry.isTranslated() || entry.isFuzzy())) {
                continue;
            }
            messages.putIfAbsent(key(entry).getBytes(charset), value(entry).getBytes(charset));
        }

        int count = messages.size();
        int originalTable = HEADER_SIZE;
        int translationTable = originalTable + 8 * count;
        int stringsStart = translationTable + 8 * count;

        ByteBuffer header = ByteBuffer.allocate(stringsStart).order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(MAGIC);
        header.putInt(0);
        header.putInt(count);
        header.putInt(originalTable);
        header.putInt(translationTable);
        header.putInt(0);
        header.putInt(stringsStart);

        ByteArrayOutputStream strings = new ByteArrayOutputStream();
        int[] keyOffsets = new int[count];
        int[] valueOffsets = new int[count];
        int i = 0;
        for (byte[] key : messages.keySet()) {
            keyOffsets[i++] = stringsStart + strings.size();
            strings.writeBytes(key);
            strings.write(0);
        }
        i = 0;
        for (byte[] value : messages.values()) {
            valueOffsets[i++] = stringsStart + strings.size();
            strings.writeBytes(value);
            strings.write(0);
        }

        i = 0;
        for (byte[] key : messages.keySet()) {
            header.putInt(key.length);
            header.putInt(keyOffsets[i++]);
        }
        i = 0;
        for (byte[] value : messages.values()) {
            header.putInt(value.length);
            header.putInt(valueOffsets[i++]);
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(stringsStart + strings.size());
        out.writeBytes(header.array());
        out.writeBytes(strings.toByteArray());
        log.debug("Compiled {} messages ({} bytes, charset {})", count, out.size(), charset);
        return out.toByteArray();
    }

    private static String key(CatalogEntry entry) {
        String key = entry.getMsgctxt() != null
                ? entry.getMsgctxt() + CONTEXT_SEPARATOR + entry.getMsgid()
                : entry.getMsgid();
        return entry.isPlural() ? key + NUL + entry.getMsgidPlural() : key;
    }

    private static String value(CatalogEntry entry) {
        if (entry.isPlural()) {
            return String.join(NUL, entry.getMsgstrPlural().values());
        }
        return entry.getMsgstr();
    }

    private static Charset resolveCharset(String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.warn("Unsupported catalog charset '{}', compiling as UTF-8", name);
            return StandardCharsets.UTF_8;
        }
    }
}
