package com.example.polyglot.cli;

import com.example.polyglot.model.CatalogException;
import com.example.polyglot.model.ExtractionRequest;
import com.example.polyglot.orchestrator.CatalogWorkflowOrchestrator;
import com.example.polyglot.reachability.ReachabilityMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Command dispatcher.
 *
 * <pre>
 *   modules   --locale-root=DIR --package-root=DIR [--module-manifest=FILE] [--lang=bn] [--output=FILE]
 *   helptexts --locale-root=DIR [--help-texts=FILE] [--module-manifest=FILE] [--lang=bn] [--output=FILE]
 *   html      --locale-root=DIR [--lang=bn] [--output=FILE]
 *   update    --locale-root=DIR --translations=FILE[,FILE...] [--lang=bn]
 *   compile   FILE.po
 * </pre>
 */
@Component
public class PolyglotCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PolyglotCommandRunner.class);

    static final String USAGE = """
            Usage: polyglot <command> [options]

            Commands:
              modules    Extract untranslated strings whose source module is loaded
                         --locale-root=DIR --package-root=DIR [--module-manifest=FILE]
              helptexts  Extract untranslated help texts whose symbol is loaded
                         --locale-root=DIR [--help-texts=FILE] [--module-manifest=FILE]
              html       Extract untranslated strings used in HTML templates
                         --locale-root=DIR
              update     Merge translation files into the catalog and compile it
                         --locale-root=DIR --translations=FILE[,FILE...]
              compile    Compile a .po catalog to .mo
                         FILE.po

            Common options:
              --lang=CODE     target language (default from configuration)
              --output=FILE   exchange file written by extraction commands
            """;

    private final CatalogWorkflowOrchestrator orchestrator;
    private final PrintStream out;
    private int exitCode;

    @Autowired
    public PolyglotCommandRunner(CatalogWorkflowOrchestrator orchestrator) {
        this(orchestrator, System.out);
    }

    PolyglotCommandRunner(CatalogWorkflowOrchestrator orchestrator, PrintStream out) {
        this.orchestrator = orchestrator;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty() || args.containsOption("help")) {
            out.print(USAGE);
            return positional.isEmpty() && !args.containsOption("help") ? 1 : 0;
        }

        String command = positional.get(0);
        try {
            Optional<ReachabilityMode> mode = ReachabilityMode.fromCommand(command);
            if (mode.isPresent()) {
                var report = orchestrator.extract(mode.get(), extractionRequest(args));
                out.printf("Total untranslated strings: %d%n", report.records().size());
                out.printf("Written to %s%n", report.outputFile());
                return 0;
            }
            switch (command) {
                case "update" -> {
                    List<Path> files = pathList(args, "translations");
                    if (files.isEmpty()) {
                        return usageError("update requires --translations");
                    }
                    var result = orchestrator.update(requiredPath(args, "locale-root"), option(args, "lang"), files);
                    out.printf("Updated: %d, skipped: %d, not found: %d (of %d)%n",
                            result.updated(), result.skipped(), result.notFound(), result.total());
                    return 0;
                }
                case "compile" -> {
                    if (positional.size() < 2) {
                        return usageError("compile requires a catalog file");
                    }
                    Path binary = orchestrator.compile(Path.of(positional.get(1)));
                    out.printf("Compiled MO file saved to: %s%n", binary);
                    return 0;
                }
                default -> {
                    return usageError("Unknown command: " + command);
                }
            }
        } catch (IllegalArgumentException e) {
            return usageError(e.getMessage());
        } catch (CatalogException e) {
            log.error("{} failed: {}", command, e.getMessage(), e);
            out.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private ExtractionRequest extractionRequest(ApplicationArguments args) {
        return new ExtractionRequest(
                requiredPath(args, "locale-root"),
                option(args, "lang"),
                optionalPath(args, "output"),
                optionalPath(args, "package-root"),
                optionalPath(args, "module-manifest"),
                optionalPath(args, "help-texts"));
    }

    private int usageError(String message) {
        out.println("Error: " + message);
        out.println();
        out.print(USAGE);
        return 1;
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }

    private static Path optionalPath(ApplicationArguments args, String name) {
        String value = option(args, name);
        return value == null || value.isBlank() ? null : Path.of(value);
    }

    private static Path requiredPath(ApplicationArguments args, String name) {
        Path path = optionalPath(args, name);
        if (path == null) {
            throw new IllegalArgumentException("Missing required option --" + name);
        }
        return path;
    }

    private static List<Path> pathList(ApplicationArguments args, String name) {
        List<Path> paths = new ArrayList<>();
        List<String> values = args.getOptionValues(name);
        if (values == null) {
            return paths;
        }
        values.stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(Path::of)
                .forEach(paths::add);
        return paths;
    }
}
