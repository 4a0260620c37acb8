package com.structds.cli;

import com.structds.core.model.Dataset;
import com.structds.core.serializer.DatasetReader;
import com.structds.core.serializer.DatasetWriter;
import com.structds.core.stats.DatasetStatistics;
import com.structds.core.stats.DatasetStatistics.Counts;
import com.structds.core.stats.LatexTableWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to print entity counts of a dataset file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * structds stats dataset.json
 * structds stats dataset.json --json
 * structds stats dataset.json --latex-output stats.tex
 * }</pre>
 */
@Command(
    name = "stats",
    description = "Print entity counts of a dataset",
    mixinStandardHelpOptions = true
)
public class StatsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(StatsCommand.class);

    private static final String ROW_FORMAT = "%-30s %8s %8s %10s %8s %6s %8s %8s%n";

    @Parameters(index = "0", description = "Dataset file")
    private Path input;

    @Option(names = {"--json"}, description = "Print statistics as JSON")
    private boolean json;

    @Option(names = {"--latex-output"}, description = "Also export the table as LaTeX to this file")
    private Path latexOutput;

    @Override
    public Integer call() {
        try {
            Dataset dataset = new DatasetReader().read(input);
            DatasetStatistics stats = DatasetStatistics.of(dataset);

            if (latexOutput != null) {
                new LatexTableWriter().write(stats, latexOutput);
                if (!json) {
                    System.out.println("✓ Wrote LaTeX table to: " + latexOutput);
                }
            }

            if (json) {
                System.out.println(new DatasetWriter().toJson(stats));
                return ExitCodes.OK;
            }

            System.out.printf(ROW_FORMAT, "Repository", "Modules", "Classes", "Functions", "Methods",
                "Ctors", "Typed", "Str");
            stats.repositories().forEach(StatsCommand::printRow);
            if (stats.repositories().size() > 1) {
                printRow(stats.total());
            }
            return ExitCodes.OK;

        } catch (IOException | UncheckedIOException e) {
            log.error("Failed to read dataset {}", input, e);
            System.err.println("✗ Failed to read dataset: " + e.getMessage());
            return ExitCodes.IO_ERROR;
        }
    }

    private static void printRow(Counts counts) {
        System.out.printf(ROW_FORMAT, counts.name(), counts.modules(), counts.classes(), counts.functions(),
            counts.methods(), counts.constructors(), counts.typedCallables(), counts.strTypedCallables());
    }
}
