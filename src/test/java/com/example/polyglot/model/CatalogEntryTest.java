package com.example.polyglot.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CatalogEntryTest {

    @Test
    void singularEntryIsTranslatedWhenMsgstrIsNonEmpty() {
        CatalogEntry entry = new CatalogEntry("Partner");
        assertFalse(entry.isTranslated());

        entry.setMsgstr("অংশীদার");
        assertTrue(entry.isTranslated());
    }

    @Test
    void pluralEntryNeedsEverySlotFilled() {
        CatalogEntry entry = new CatalogEntry("%s item", "%s items");
        assertFalse(entry.isTranslated(), "no slots at all");

        entry.setPluralForm(0, "%s আইটেম");
        entry.setPluralForm(1, "");
        assertFalse(entry.isTranslated());

        entry.setPluralForm(1, "%s আইটেমগুলি");
        assertTrue(entry.isTranslated());
    }

    @Test
    void pluralEntryIgnoresSingularMsgstr() {
        CatalogEntry entry = new CatalogEntry("%s item", "%s items");
        entry.setMsgstr("stray");
        assertFalse(entry.isTranslated());
    }

    @Test
    void fuzzyFlagIsKeptAlongsideOtherFlags() {
        CatalogEntry entry = new CatalogEntry("Name");
        entry.getFlags().add("python-format");
        entry.setFuzzy(true);
        assertTrue(entry.isFuzzy());

        entry.setFuzzy(false);
        assertFalse(entry.isFuzzy());
        assertEquals(1, entry.getFlags().size());
        assertTrue(entry.getFlags().contains("python-format"));
    }

    @Test
    void emptyPluralIsTreatedAsSingular() {
        CatalogEntry entry = new CatalogEntry("Name", "");
        assertFalse(entry.isPlural());
        assertNull(entry.getMsgidPlural());
    }

    @Test
    void headerIsRecognizedByEmptyMsgid() {
        assertTrue(new CatalogEntry("").isHeader());
        assertFalse(new CatalogEntry("", "ctx", null).isHeader());
    }
}
