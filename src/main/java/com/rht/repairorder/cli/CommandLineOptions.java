package com.rht.repairorder.cli;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.logging.LogLevel;

import java.util.List;
import java.util.Optional;

/**
 * Options understood on the command line:
 * {@code --data-dir=<path>}, and at most one of {@code --verbose} (DEBUG) or {@code --quiet} (WARN).
 */
public final class CommandLineOptions {

    public static final String DATA_DIR = "data-dir";
    public static final String VERBOSE = "verbose";
    public static final String QUIET = "quiet";

    private final String dataDir;
    private final LogLevel logLevel;

    private CommandLineOptions(String dataDir, LogLevel logLevel) {
        this.dataDir = dataDir;
        this.logLevel = logLevel;
    }

    /**
     * @throws IllegalArgumentException on conflicting verbosity flags or an empty data directory
     */
    public static CommandLineOptions parse(ApplicationArguments args) {
        boolean verbose = args.containsOption(VERBOSE);
        boolean quiet = args.containsOption(QUIET);
        if (verbose && quiet) {
            throw new IllegalArgumentException("--" + VERBOSE + " and --" + QUIET + " are mutually exclusive");
        }

        String dataDir = null;
        List<String> values = args.getOptionValues(DATA_DIR);
        if (values != null) {
            if (values.size() != 1 || values.get(0).isBlank()) {
                throw new IllegalArgumentException("--" + DATA_DIR + " takes exactly one non-empty path");
            }
            dataDir = values.get(0);
        }

        LogLevel logLevel = verbose ? LogLevel.DEBUG : quiet ? LogLevel.WARN : null;
        return new CommandLineOptions(dataDir, logLevel);
    }

    public Optional<String> getDataDir() {
        return Optional.ofNullable(dataDir);
    }

    public Optional<LogLevel> getLogLevel() {
        return Optional.ofNullable(logLevel);
    }
}
