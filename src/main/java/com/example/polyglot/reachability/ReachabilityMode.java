package com.example.polyglot.reachability;

import java.util.Arrays;
import java.util.Optional;

/**
 * Selects which {@link ReachabilityStrategy} an extraction run uses.
 */
public enum ReachabilityMode {

    /** Occurrence paths mapped to loaded modules. */
    MODULES("modules", "translateables.json"),
    /** Dotted help-text keys resolved against loaded symbols. */
    HELP_TEXTS("helptexts", "translateables.json"),
    /** Occurrences in template files. */
    TEMPLATES("html", "translateables_html.json");

    private final String command;
    private final String defaultOutputFile;

    ReachabilityMode(String command, String defaultOutputFile) {
        this.command = command;
        this.defaultOutputFile = defaultOutputFile;
    }

    public String command() {
        return command;
    }

    public String defaultOutputFile() {
        return defaultOutputFile;
    }

    public static Optional<ReachabilityMode> fromCommand(String command) {
        return Arrays.stream(values()).filter(m -> m.command.equals(command)).findFirst();
    }
}
