package com.example.polyglot.cli;

import com.example.polyglot.TestFixtures;
import com.example.polyglot.catalog.CatalogLocator;
import com.example.polyglot.catalog.PoCatalogStore;
import com.example.polyglot.config.JacksonConfig;
import com.example.polyglot.config.PolyglotProperties;
import com.example.polyglot.orchestrator.CatalogWorkflowOrchestrator;
import com.example.polyglot.service.ExchangeFileService;
import com.example.polyglot.service.ExtractionService;
import com.example.polyglot.service.MergeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PolyglotCommandRunnerTest {

    @TempDir
    Path root;

    private Path catalogPath;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private PolyglotCommandRunner runner;

    @BeforeEach
    void setUp() {
        catalogPath = TestFixtures.demoProject(root);
        PolyglotProperties properties = PolyglotProperties.defaults();
        CatalogWorkflowOrchestrator orchestrator = new CatalogWorkflowOrchestrator(
                new CatalogLocator(properties),
                new PoCatalogStore(),
                new ExtractionService(properties),
                new MergeService(properties),
                new ExchangeFileService(JacksonConfig.createObjectMapper()),
                properties);
        runner = new PolyglotCommandRunner(orchestrator, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private int run(String... args) {
        return runner.execute(new DefaultApplicationArguments(args));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void noCommandPrintsUsageAndFails() {
        assertEquals(1, run());
        assertTrue(output().contains("Usage: polyglot"));
    }

    @Test
    void helpSucceeds() {
        assertEquals(0, run("--help"));
        assertTrue(output().contains("Commands:"));
    }

    @Test
    void unknownCommandIsAUsageError() {
        assertEquals(1, run("translate"));
        assertTrue(output().contains("Unknown command: translate"));
    }

    @Test
    void htmlCommandWritesExchangeFile() {
        Path out = root.resolve("html.json");

        assertEquals(0, run("html", "--locale-root=" + root, "--output=" + out));

        assertTrue(Files.exists(out));
        assertTrue(output().contains("Total untranslated strings: 1"));
    }

    @Test
    void modulesCommandUsesManifest() {
        int code = run("modules",
                "--locale-root=" + root,
                "--package-root=" + root,
                "--module-manifest=" + root.resolve("module-manifest.json"),
                "--output=" + root.resolve("modules.json"));

        assertEquals(0, code);
        assertTrue(output().contains("Total untranslated strings: 2"));
    }

    @Test
    void missingLocaleRootIsAUsageError() {
        assertEquals(1, run("html"));
        assertTrue(output().contains("Missing required option --locale-root"));
    }

    @Test
    void updateRequiresTranslations() {
        assertEquals(1, run("update", "--locale-root=" + root));
        assertTrue(output().contains("update requires --translations"));
    }

    @Test
    void updateReportsCounts() {
        int code = run("update", "--locale-root=" + root, "--translations=" + root.resolve("translated.json"));

        assertEquals(0, code);
        assertTrue(output().contains("Updated: 2, skipped: 1, not found: 1 (of 4)"), output());
        assertTrue(Files.exists(catalogPath.resolveSibling("django.mo")));
    }

    @Test
    void compileCommandNeedsAFile() {
        assertEquals(1, run("compile"));
        assertEquals(0, run("compile", catalogPath.toString()));
        assertTrue(Files.exists(catalogPath.resolveSibling("django.mo")));
    }

    @Test
    void missingCatalogIsReportedAsError() {
        assertEquals(1, run("html", "--locale-root=" + root, "--lang=de", "--output=" + root.resolve("x.json")));
        assertTrue(output().contains("Error: "));
    }
}
