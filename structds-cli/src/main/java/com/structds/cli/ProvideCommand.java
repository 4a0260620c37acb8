package com.structds.cli;

import com.structds.core.extractor.python.PythonSourceExtractor;
import com.structds.core.model.Dataset;
import com.structds.core.serializer.CallableExporter;
import com.structds.core.serializer.DatasetReader;
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
 * Command to export every function and method of a dataset as a standalone source file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * structds provide dataset.json -o callables/
 * structds provide dataset.json -o untyped/ --without-type-annotations
 * }</pre>
 */
@Command(
    name = "provide",
    description = "Export every callable of a dataset as a standalone .py file",
    mixinStandardHelpOptions = true
)
public class ProvideCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProvideCommand.class);

    @Parameters(index = "0", description = "Dataset file")
    private Path input;

    @Option(names = {"-o", "--output"}, required = true, description = "Output directory")
    private Path outputDirectory;

    @Option(
        names = {"--without-type-annotations"},
        description = "Remove parameter, return and variable type annotations from the exported code"
    )
    private boolean withoutTypeAnnotations;

    @Override
    public Integer call() {
        try {
            Dataset dataset = new DatasetReader().read(input);
            CallableExporter exporter = withoutTypeAnnotations
                ? CallableExporter.withoutTypeAnnotations(new PythonSourceExtractor())
                : new CallableExporter();
            int written = exporter.export(dataset, outputDirectory);
            System.out.println("✓ Exported " + written + " callables to: " + outputDirectory);
            return ExitCodes.OK;
        } catch (IOException | UncheckedIOException e) {
            log.error("Export failed", e);
            System.err.println("✗ Export failed: " + e.getMessage());
            return ExitCodes.IO_ERROR;
        }
    }
}
