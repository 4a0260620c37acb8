package com.structds.cli;

import com.structds.core.DatasetBuilder;
import com.structds.core.config.ConfigLoader;
import com.structds.core.config.ConfigurationException;
import com.structds.core.config.DatasetConfig;
import com.structds.core.config.DatasetConfig.ExtractionConfig;
import com.structds.core.extraction.ExtractionFailure;
import com.structds.core.extraction.ExtractionStatistics;
import com.structds.core.filter.FilterChain;
import com.structds.core.model.Repository;
import com.structds.core.model.RepositoryIdentity;
import com.structds.core.serializer.DatasetWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to extract one repository checkout into a dataset file.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load configuration and resolve the filter chain</li>
 *   <li>Discover and read source files</li>
 *   <li>Extract modules in parallel, recording files that fail</li>
 *   <li>Apply the filter chain</li>
 *   <li>Write the dataset and, if requested, the run report</li>
 * </ol>
 *
 * <p>An unknown filter name stops the command before any file is read.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Extract with defaults from structds.yaml
 * structds extract ./checkout --name requests
 *
 * # Override filters and output
 * structds extract ./checkout --name requests --filters NoStringTypeFilter,EmptyFilter \
 *     -o requests.json --report requests-report.json
 * }</pre>
 */
@Command(
    name = "extract",
    description = "Extract a repository checkout into a dataset file",
    mixinStandardHelpOptions = true
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    @Parameters(
        index = "0",
        description = "Repository checkout directory (default: current directory)",
        defaultValue = "."
    )
    private Path root;

    @Option(names = {"-n", "--name"}, description = "Package name (default: directory name)")
    private String name;

    @Option(names = {"--url"}, description = "Source URL of the repository", defaultValue = "")
    private String url;

    @Option(names = {"--tag"}, description = "Release tag", defaultValue = "")
    private String tag;

    @Option(names = {"--revision"}, description = "Exact revision identifier", defaultValue = "")
    private String revision;

    @Option(
        names = {"-f", "--filters"},
        description = "Comma-separated filter chain (overrides config)"
    )
    private String filters;

    @Option(names = {"-w", "--workers"}, description = "Number of extraction workers (overrides config)")
    private Integer workers;

    @Option(names = {"-t", "--timeout"}, description = "Extraction timeout in seconds, 0 for none (overrides config)")
    private Long timeoutSeconds;

    @Option(names = {"-o", "--output"}, description = "Dataset file (overrides config)")
    private Path output;

    @Option(names = {"--report"}, description = "Run report file (overrides config)")
    private Path report;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file, relative to the checkout (default: structds.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        try {
            DatasetConfig config = loadConfiguration();
            DatasetBuilder builder = new DatasetBuilder(config);
            FilterChain chain = builder.validate();

            RepositoryIdentity identity = new RepositoryIdentity(repositoryName(), url, tag, revision);
            System.out.println("Extracting repository: " + identity.name() + " (" + root.toAbsolutePath() + ")");
            System.out.println("Filters: " + (chain.isEmpty() ? "none" : chain.toString()));
            System.out.println();

            DatasetBuilder.Result result = builder.build(root, identity);
            printExtractionSummary(result);

            Path datasetPath = output != null ? output : Paths.get(config.output().dataset());
            List<Repository> repositories = result.repository().map(List::of).orElse(List.of());
            DatasetWriter writer = new DatasetWriter();
            writer.write(repositories, datasetPath);
            System.out.println("✓ Wrote dataset to: " + datasetPath);

            Path reportPath = report != null ? report
                : config.output().report() != null ? Paths.get(config.output().report()) : null;
            if (reportPath != null) {
                writer.writeReport(result.toRunReport(), reportPath);
                System.out.println("✓ Wrote run report to: " + reportPath);
            }

            System.out.println();
            System.out.println("✓ Extraction complete");
            return ExitCodes.OK;

        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.err.println("✗ Invalid configuration: " + e.getMessage());
            return ExitCodes.CONFIGURATION_ERROR;
        } catch (IOException | UncheckedIOException e) {
            log.error("Extraction failed", e);
            System.err.println("✗ Extraction failed: " + e.getMessage());
            return ExitCodes.IO_ERROR;
        }
    }

    /**
     * Loads the configuration file and applies command line overrides.
     */
    private DatasetConfig loadConfiguration() {
        Path absoluteConfigPath = configPath.isAbsolute() ? configPath : root.resolve(configPath);
        log.debug("Loading configuration from: {}", absoluteConfigPath);
        DatasetConfig config = ConfigLoader.load(absoluteConfigPath);

        if (filters != null) {
            config = config.withFilters(Arrays.asList(filters.split(",")));
        }
        if (workers != null || timeoutSeconds != null) {
            ExtractionConfig extraction = config.extraction();
            config = config.withExtraction(new ExtractionConfig(
                workers != null ? workers : extraction.workers(),
                timeoutSeconds != null ? timeoutSeconds : extraction.timeoutSeconds(),
                extraction.exclude()
            ));
        }
        return config;
    }

    private String repositoryName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        Path fileName = root.toAbsolutePath().normalize().getFileName();
        return fileName != null ? fileName.toString() : "repository";
    }

    private void printExtractionSummary(DatasetBuilder.Result result) {
        ExtractionStatistics stats = result.extraction().statistics();
        System.out.println("✓ Discovered " + stats.filesDiscovered() + " source files");
        System.out.println("✓ Extracted " + stats.filesParsed() + " modules");

        List<ExtractionFailure> failures = result.extraction().failures();
        if (!failures.isEmpty()) {
            System.out.println("⚠ " + failures.size() + " files skipped:");
            failures.stream().limit(10).forEach(f -> System.out.println("    - " + f.describe()));
            if (failures.size() > 10) {
                System.out.println("    ... and " + (failures.size() - 10) + " more");
            }
        }

        System.out.println("✓ Filters removed " + result.filtering().exclusions().size() + " entities");
        result.repository().ifPresentOrElse(
            repository -> System.out.println("✓ Retained " + repository.modules().size() + " modules"),
            () -> System.out.println("⚠ Repository removed by filters")
        );
    }
}
