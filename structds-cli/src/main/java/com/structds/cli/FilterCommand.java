package com.structds.cli;

import com.structds.core.config.ConfigurationException;
import com.structds.core.filter.FilterChain;
import com.structds.core.filter.FilterExclusion;
import com.structds.core.filter.FilterRegistry;
import com.structds.core.filter.FilterReport;
import com.structds.core.model.Dataset;
import com.structds.core.model.Repository;
import com.structds.core.serializer.DatasetReader;
import com.structds.core.serializer.DatasetWriter;
import com.structds.core.serializer.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to apply a filter chain to an existing dataset file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * structds filter dataset.json --filters StrTypeFilter,EmptyFilter -o dataset-str.json
 * }</pre>
 */
@Command(
    name = "filter",
    description = "Apply a filter chain to an existing dataset",
    mixinStandardHelpOptions = true
)
public class FilterCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FilterCommand.class);

    @Parameters(index = "0", description = "Dataset file to filter")
    private Path input;

    @Option(names = {"-f", "--filters"}, required = true, description = "Comma-separated filter chain")
    private String filters;

    @Option(names = {"-o", "--output"}, required = true, description = "Filtered dataset file")
    private Path output;

    @Option(names = {"--report"}, description = "Write the exclusions of every repository to this file")
    private Path report;

    @Override
    public Integer call() {
        try {
            FilterChain chain = FilterRegistry.defaults().resolve(filters);
            Dataset dataset = new DatasetReader().read(input);
            System.out.println("✓ Read " + dataset.repositories().size() + " repositories from " + input);

            List<Repository> retained = new ArrayList<>();
            List<RunReport> reports = new ArrayList<>();
            int excluded = 0;
            for (Repository repository : dataset.repositories()) {
                FilterReport filtered = chain.applyWithReport(repository);
                filtered.retained().ifPresent(retained::add);
                List<FilterExclusion> exclusions = filtered.exclusions();
                excluded += exclusions.size();
                reports.add(new RunReport(repository.name(), chain.names(), null, List.of(), exclusions));
            }
            System.out.println("✓ Filters [" + chain + "] removed " + excluded + " entities");

            DatasetWriter writer = new DatasetWriter();
            writer.write(retained, output);
            System.out.println("✓ Wrote " + retained.size() + " repositories to: " + output);
            if (report != null) {
                writer.writeReports(reports, report);
                System.out.println("✓ Wrote exclusion report to: " + report);
            }
            return ExitCodes.OK;

        } catch (ConfigurationException e) {
            log.error("Invalid filter chain: {}", e.getMessage());
            System.err.println("✗ Invalid filter chain: " + e.getMessage());
            return ExitCodes.CONFIGURATION_ERROR;
        } catch (IOException | UncheckedIOException e) {
            log.error("Filtering failed", e);
            System.err.println("✗ Filtering failed: " + e.getMessage());
            return ExitCodes.IO_ERROR;
        }
    }
}
