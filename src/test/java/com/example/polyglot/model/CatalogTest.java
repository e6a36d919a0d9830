package com.example.polyglot.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CatalogTest {

    private static Catalog catalogWithHeader(String headerText) {
        Catalog catalog = new Catalog();
        CatalogEntry header = new CatalogEntry("");
        header.setMsgstr(headerText);
        catalog.add(header);
        catalog.add(new CatalogEntry("Partner"));
        catalog.add(new CatalogEntry("partner"));
        return catalog;
    }

    @Test
    void findIsExactAndCaseSensitive() {
        Catalog catalog = catalogWithHeader("");

        assertEquals("Partner", catalog.find("Partner").orElseThrow().getMsgid());
        assertEquals("partner", catalog.find("partner").orElseThrow().getMsgid());
        assertTrue(catalog.find("PARTNER").isEmpty());
        assertTrue(catalog.find("Partner ").isEmpty());
    }

    @Test
    void findNeverReturnsTheHeader() {
        Catalog catalog = catalogWithHeader("Content-Type: text/plain; charset=UTF-8\n");
        assertTrue(catalog.find("").isEmpty());
        assertTrue(catalog.header().isPresent());
    }

    @Test
    void metadataAndPluralCountComeFromHeader() {
        Catalog catalog = catalogWithHeader(
                "Content-Type: text/plain; charset=ISO-8859-1\nPlural-Forms: nplurals=3; plural=(n%10==1 ? 0 : 1);\n");

        assertEquals(3, catalog.pluralFormCount());
        assertEquals("ISO-8859-1", catalog.charset());
        assertEquals("text/plain; charset=ISO-8859-1", catalog.metadata().get("Content-Type"));
    }

    @Test
    void defaultsWithoutHeader() {
        Catalog catalog = new Catalog();
        assertEquals(2, catalog.pluralFormCount());
        assertEquals("UTF-8", catalog.charset());
    }
}
