package com.example.polyglot.catalog;

import com.example.polyglot.model.Catalog;
import com.example.polyglot.model.CatalogEntry;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.polyglot.TestFixtures.catalogOf;
import static com.example.polyglot.TestFixtures.plural;
import static com.example.polyglot.TestFixtures.singular;
import static org.junit.jupiter.api.Assertions.*;

class MoCompilerTest {

    private static final String HEADER = "Content-Type: text/plain; charset=UTF-8\n";

    private final MoCompiler compiler = new MoCompiler();

    /** Reads the (original, translation) pairs back out of a compiled table. */
    private static Map<String, String> readTable(byte[] mo) {
        ByteBuffer buffer = ByteBuffer.wrap(mo).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(MoCompiler.MAGIC, buffer.getInt(0));
        assertEquals(0, buffer.getInt(4));
        int count = buffer.getInt(8);
        int originals = buffer.getInt(12);
        int translations = buffer.getInt(16);
        assertEquals(0, buffer.getInt(20));

        Map<String, String> table = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            table.put(string(mo, buffer, originals + 8 * i), string(mo, buffer, translations + 8 * i));
        }
        return table;
    }

    private static String string(byte[] mo, ByteBuffer buffer, int descriptor) {
        int length = buffer.getInt(descriptor);
        int offset = buffer.getInt(descriptor + 4);
        assertEquals(0, mo[offset + length], "strings are NUL-terminated");
        return new String(mo, offset, length, StandardCharsets.UTF_8);
    }

    @Test
    void onlyHeaderAndTranslatedNonFuzzyEntriesAreCompiled() {
        CatalogEntry fuzzy = singular("Street", "Rue");
        fuzzy.setFuzzy(true);
        Catalog catalog = catalogOf(
                singular("", HEADER),
                singular("Partner", "Partenaire"),
                singular("Welcome", ""),
                fuzzy);

        Map<String, String> table = readTable(compiler.compile(catalog));

        assertEquals(Map.of("", HEADER, "Partner", "Partenaire"), table);
    }

    @Test
    void keysAreSortedByBytes() {
        Catalog catalog = catalogOf(
                singular("", HEADER),
                singular("b", "2"),
                singular("B", "1"),
                singular("ä", "3"),
                singular("a", "0"));

        List<String> keys = new ArrayList<>(readTable(compiler.compile(catalog)).keySet());

        assertEquals(List.of("", "B", "a", "b", "ä"), keys);
    }

    @Test
    void pluralAndContextKeysUseGettextSeparators() {
        CatalogEntry files = plural("%d file", "%d files");
        files.setPluralForm(0, "%d fichier");
        files.setPluralForm(1, "%d fichiers");
        CatalogEntry open = new CatalogEntry("Open", "menu", null);
        open.setMsgstr("Ouvrir");

        Map<String, String> table = readTable(compiler.compile(catalogOf(singular("", HEADER), files, open)));

        assertEquals("%d fichier\u0000%d fichiers", table.get("%d file\u0000%d files"));
        assertEquals("Ouvrir", table.get("menu\u0004Open"));
    }

    @Test
    void outputIsDeterministic() {
        Catalog first = catalogOf(singular("", HEADER), singular("x", "1"), singular("y", "2"));
        Catalog second = catalogOf(singular("y", "2"), singular("", HEADER), singular("x", "1"));

        assertArrayEquals(compiler.compile(first), compiler.compile(second));
    }

    @Test
    void emptyCatalogCompilesToBareHeader() {
        byte[] mo = compiler.compile(new Catalog());
        assertEquals(28, mo.length);
        assertTrue(readTable(mo).isEmpty());
    }
}
