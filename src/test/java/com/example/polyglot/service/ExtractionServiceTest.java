package com.example.polyglot.service;

import com.example.polyglot.config.PolyglotProperties;
import com.example.polyglot.model.Catalog;
import com.example.polyglot.model.CatalogEntry;
import com.example.polyglot.model.ExchangeRecord;
import com.example.polyglot.reachability.ReachabilityStrategy;
import com.example.polyglot.reachability.TemplateSourceReachability;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static com.example.polyglot.TestFixtures.catalogOf;
import static com.example.polyglot.TestFixtures.plural;
import static com.example.polyglot.TestFixtures.singular;
import static org.junit.jupiter.api.Assertions.*;

class ExtractionServiceTest {

    private static final ReachabilityStrategy EVERYTHING = entry -> Optional.of("test");

    private final ExtractionService service = new ExtractionService(PolyglotProperties.defaults());

    @Test
    void onlyUntranslatedReachableEntriesAreExtracted() {
        Catalog catalog = catalogOf(
                singular("", "Content-Type: text/plain; charset=UTF-8\n"),
                singular("Welcome", "", "app/templates/base.html:1"),
                singular("Partner", "", "app/models.py:3"),
                singular("Name", "Nom", "app/templates/detail.html:9"));

        List<ExchangeRecord> records = service.extract(catalog, new TemplateSourceReachability());

        assertEquals(List.of(new ExchangeRecord("Welcome", null)), records);
    }

    @Test
    void headerIsNeverExtracted() {
        Catalog catalog = catalogOf(singular("", ""), singular("Partner", ""));
        assertEquals(List.of(new ExchangeRecord("Partner", null)), service.extract(catalog, EVERYTHING));
    }

    @Test
    void pluralEntriesCarryThePluralSource() {
        CatalogEntry partial = plural("%d item", "%d items");
        partial.setPluralForm(0, "%d élément");

        List<ExchangeRecord> records = service.extract(catalogOf(partial), EVERYTHING);

        assertEquals(1, records.size());
        assertTrue(records.get(0).isPlural());
        assertEquals("%d items", records.get(0).msgidPlural());
    }

    @Test
    void fullyTranslatedPluralIsSkipped() {
        CatalogEntry done = plural("%d item", "%d items");
        done.setPluralForm(0, "%d élément");
        done.setPluralForm(1, "%d éléments");
        assertTrue(service.extract(catalogOf(done), EVERYTHING).isEmpty());
    }

    @Test
    void duplicateMsgidsAreEmittedOnce() {
        Catalog catalog = catalogOf(
                new CatalogEntry("Open", "menu", null),
                new CatalogEntry("Open", "door", null),
                singular("Close", ""));

        List<String> msgids = service.extract(catalog, EVERYTHING).stream().map(ExchangeRecord::msgid).toList();

        assertEquals(List.of("Open", "Close"), msgids);
    }

    @Test
    void recordsFollowCatalogOrder() {
        Catalog catalog = catalogOf(singular("b", ""), singular("a", ""), singular("c", ""));
        List<String> msgids = service.extract(catalog, EVERYTHING).stream().map(ExchangeRecord::msgid).toList();
        assertEquals(List.of("b", "a", "c"), msgids);
    }

    @Test
    void streamIsLazyAndSingleUse() {
        int[] consulted = {0};
        ReachabilityStrategy counting = entry -> {
            consulted[0]++;
            return Optional.of("test");
        };
        Catalog catalog = catalogOf(singular("a", ""), singular("b", ""), singular("c", ""));

        Stream<ExchangeRecord> stream = service.stream(catalog, counting);
        assertEquals(0, consulted[0]);

        assertEquals("a", stream.findFirst().orElseThrow().msgid());
        assertEquals(1, consulted[0]);
        assertThrows(IllegalStateException.class, stream::count);
    }

    @Test
    void emptyCatalogYieldsNothing() {
        assertTrue(service.extract(new Catalog(), EVERYTHING).isEmpty());
    }
}
