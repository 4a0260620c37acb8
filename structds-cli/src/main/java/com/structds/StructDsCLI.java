package com.structds;

import ch.qos.logback.classic.Level;
import com.structds.cli.ExtractCommand;
import com.structds.cli.FilterCommand;
import com.structds.cli.ListCommand;
import com.structds.cli.ProvideCommand;
import com.structds.cli.StatsCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for StructDS.
 *
 * <p>StructDS extracts the structure of Python repositories (modules, classes, functions,
 * methods and their signatures) into a JSON dataset and filters it by name-based policies.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code extract} - Extract one repository checkout into a dataset file</li>
 *   <li>{@code filter} - Apply a filter chain to an existing dataset</li>
 *   <li>{@code list} - List available filters</li>
 *   <li>{@code stats} - Print entity counts of a dataset</li>
 *   <li>{@code provide} - Export every callable as a standalone source file</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Extract a checkout, keeping typed callables only
 * structds extract ./requests --name requests --tag v2.32.3 --revision 0e322af8 \
 *     --filters TestModuleFilter,NoStringTypeFilter,EmptyFilter -o requests.json
 *
 * # Re-filter an existing dataset
 * structds filter requests.json --filters StrTypeFilter,EmptyFilter -o requests-str.json
 * }</pre>
 */
@Command(
    name = "structds",
    mixinStandardHelpOptions = true,
    version = "StructDS 1.0.0-SNAPSHOT",
    description = "Structural dataset extraction and filtering for Python repositories",
    subcommands = {
        ExtractCommand.class,
        FilterCommand.class,
        ListCommand.class,
        StatsCommand.class,
        ProvideCommand.class
    }
)
public class StructDsCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StructDsCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("StructDS - Structural dataset extraction for Python repositories");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'structds --help' to see available commands");
        System.out.println("Use 'structds <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Verbose logging enabled");
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        StructDsCLI cli = new StructDsCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
