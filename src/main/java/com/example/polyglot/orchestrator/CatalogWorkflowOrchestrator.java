package com.example.polyglot.orchestrator;

import com.example.polyglot.catalog.CatalogLocator;
import com.example.polyglot.catalog.CatalogStore;
import com.example.polyglot.config.PolyglotProperties;
import com.example.polyglot.model.Catalog;
import com.example.polyglot.model.ExchangeRecord;
import com.example.polyglot.model.ExtractionReport;
import com.example.polyglot.model.ExtractionRequest;
import com.example.polyglot.model.MergeResult;
import com.example.polyglot.model.TranslationValue;
import com.example.polyglot.reachability.ClassLoaderReachabilitySource;
import com.example.polyglot.reachability.DottedSymbolReachability;
import com.example.polyglot.reachability.ModulePathReachability;
import com.example.polyglot.reachability.ReachabilityMode;
import com.example.polyglot.reachability.ReachabilitySource;
import com.example.polyglot.reachability.ReachabilityStrategy;
import com.example.polyglot.reachability.StaticReachabilitySource;
import com.example.polyglot.reachability.TemplateSourceReachability;
import com.example.polyglot.service.ExchangeFileService;
import com.example.polyglot.service.ExtractionService;
import com.example.polyglot.service.MergeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Catalog workflows.
 * Extract:
 * 1. Locate and load the catalog
 * 2. Build the reachability strategy for the mode
 * 3. Extract untranslated reachable entries
 * 4. Write the exchange file
 * Update:
 * 1. Locate and load the catalog
 * 2. Load translation files
 * 3. Merge
 * 4. Save the catalog and compile the binary table
 */
@Service
public class CatalogWorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CatalogWorkflowOrchestrator.class);

    private static final String RULE = "=".repeat(80);
    private static final String DEFAULT_SYMBOL_TEXTS = "help_texts.json";

    private final CatalogLocator locator;
    private final CatalogStore catalogStore;
    private final ExtractionService extractionService;
    private final MergeService mergeService;
    private final ExchangeFileService exchangeFiles;
    private final PolyglotProperties properties;

    public CatalogWorkflowOrchestrator(CatalogLocator locator,
                                       CatalogStore catalogStore,
                                       ExtractionService extractionService,
                                       MergeService mergeService,
                                       ExchangeFileService exchangeFiles,
                                       PolyglotProperties properties) {
        this.locator = locator;
        this.catalogStore = catalogStore;
        this.extractionService = extractionService;
        this.mergeService = mergeService;
        this.exchangeFiles = exchangeFiles;
        this.properties = properties;
    }

    public ExtractionReport extract(ReachabilityMode mode, ExtractionRequest request) {
        Path catalogPath = locator.locate(request.localeRoot(), request.language());
        log.info("Loading catalog from: {}", catalogPath);
        Catalog catalog = catalogStore.load(catalogPath);

        ReachabilityStrategy strategy = strategyFor(mode, request);
        List<ExchangeRecord> records = extractionService.extract(catalog, strategy);

        Path outputFile = request.outputFile() != null
                ? request.outputFile()
                : Path.of(mode.defaultOutputFile());
        exchangeFiles.writeRecords(outputFile, records);
        return new ExtractionReport(catalogPath, outputFile, records);
    }

    public MergeResult update(Path localeRoot, String language, List<Path> translationFiles) {
        Path catalogPath = locator.locate(localeRoot, language);
        log.info("Loading catalog from: {}", catalogPath);
        Catalog catalog = catalogStore.load(catalogPath);

        Map<String, TranslationValue> translations = exchangeFiles.loadTranslations(translationFiles);
        log.info("Total translations to apply: {}", translations.size());

        MergeResult result = mergeService.merge(catalog, translations);

        log.info("Saving updated catalog to: {}", catalogPath);
        Path binaryPath = catalogStore.saveCompiled(catalog, catalogPath);
        log.info("Compiled binary catalog to: {}", binaryPath);

        log.info(RULE);
        log.info("SUMMARY:");
        log.info("  Total translations in JSON files: {}", result.total());
        log.info("  Successfully updated: {}", result.updated());
        log.info("  Skipped (empty or mismatched): {}", result.skipped());
        log.info("  Not found in catalog: {}", result.notFound());
        log.info(RULE);
        return result;
    }

    public Path compile(Path catalogPath) {
        log.info("Compiling catalog: {}", catalogPath);
        Catalog catalog = catalogStore.load(catalogPath);
        Path binaryPath = catalogStore.compileBinary(catalog, catalogPath);
        log.info("Compiled binary catalog saved to: {}", binaryPath);
        return binaryPath;
    }

    ReachabilityStrategy strategyFor(ReachabilityMode mode, ExtractionRequest request) {
        PolyglotProperties.Extraction extraction = properties.extraction();
        return switch (mode) {
            case MODULES -> new ModulePathReachability(
                    request.packageRoot(), reachabilitySource(request), extraction.sourceSuffix());
            case HELP_TEXTS -> {
                Path texts = request.symbolTexts() != null
                        ? request.symbolTexts()
                        : request.localeRoot().resolve(DEFAULT_SYMBOL_TEXTS);
                yield new DottedSymbolReachability(exchangeFiles.readSymbolTexts(texts), reachabilitySource(request));
            }
            case TEMPLATES -> new TemplateSourceReachability(extraction.templateSuffix());
        };
    }

    private ReachabilitySource reachabilitySource(ExtractionRequest request) {
        if (request.moduleManifest() != null) {
            log.info("Reading loaded modules from manifest: {}", request.moduleManifest());
            return StaticReachabilitySource.fromManifest(exchangeFiles.readJson(request.moduleManifest()));
        }
        log.info("No module manifest given, resolving against the JVM class loader");
        return ClassLoaderReachabilitySource.ofContextClassLoader();
    }
}
