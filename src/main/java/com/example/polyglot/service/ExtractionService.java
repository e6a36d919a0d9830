package com.example.polyglot.service;

import com.example.polyglot.config.PolyglotProperties;
import com.example.polyglot.model.Catalog;
import com.example.polyglot.model.CatalogEntry;
import com.example.polyglot.model.ExchangeRecord;
import com.example.polyglot.reachability.ReachabilityStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Selects the untranslated, reachable entries of a catalog and turns them into exchange records.
 * <p>
 * Records follow catalog order. A msgid is emitted once per run; later entries with the same
 * msgid are dropped silently.
 */
@Service
public class ExtractionService {

    private static final Logger log = LoggerFactory.getLogger(ExtractionService.class);

    private final int previewLength;

    public ExtractionService(PolyglotProperties properties) {
        this.previewLength = properties.extraction().previewLength();
    }

    /**
     * Lazy, single-use stream of exchange records. Each record is logged when it is produced.
     */
    public Stream<ExchangeRecord> stream(Catalog catalog, ReachabilityStrategy strategy) {
        Set<String> seen = new HashSet<>();
        return catalog.entries().stream()
                .filter(entry -> !entry.isHeader())
                .filter(entry -> !entry.isTranslated())
                .flatMap(entry -> strategy.match(entry).stream().map(label -> new Candidate(entry, label)))
                .filter(candidate -> seen.add(candidate.entry().getMsgid()))
                .map(this::toRecord);
    }

    public List<ExchangeRecord> extract(Catalog catalog, ReachabilityStrategy strategy) {
        List<ExchangeRecord> records = stream(catalog, strategy).toList();
        log.info("Total untranslated reachable strings: {}", records.size());
        return records;
    }

    private ExchangeRecord toRecord(Candidate candidate) {
        CatalogEntry entry = candidate.entry();
        if (entry.isPlural()) {
            int half = Math.max(1, previewLength * 4 / 5);
            log.info("Found untranslated plural in {}: {} / {}",
                    candidate.label(),
                    Previews.of(entry.getMsgid(), half),
                    Previews.of(entry.getMsgidPlural(), half));
        } else {
            log.info("Found untranslated in {}: {}", candidate.label(), Previews.of(entry.getMsgid(), previewLength));
        }
        return ExchangeRecord.of(entry);
    }

    private record Candidate(CatalogEntry entry, String label) {}
}
