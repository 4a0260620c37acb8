package com.structds.core.serializer;

import com.structds.core.model.Dataset;
import com.structds.core.model.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes datasets and run reports as JSON files.
 *
 * <p>A dataset file is a JSON array of repositories. Parent directories are created and
 * existing files are overwritten.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * DatasetWriter writer = new DatasetWriter();
 * writer.write(List.of(repository), Path.of("out/dataset.json"));
 * writer.writeReport(report, Path.of("out/report.json"));
 * }</pre>
 */
public class DatasetWriter {

    private static final Logger log = LoggerFactory.getLogger(DatasetWriter.class);

    /**
     * Writes repositories as a dataset file.
     *
     * @param repositories repositories in output order
     * @param target dataset file
     * @throws IOException if the file cannot be written
     */
    public void write(List<Repository> repositories, Path target) throws IOException {
        writeJson(repositories, target);
        log.info("Wrote {} repositories to {}", repositories.size(), target);
    }

    /**
     * Writes a dataset.
     *
     * @param dataset dataset to write
     * @param target dataset file
     * @throws IOException if the file cannot be written
     */
    public void write(Dataset dataset, Path target) throws IOException {
        write(dataset.repositories(), target);
    }

    /**
     * Writes a run report.
     *
     * @param report run report
     * @param target report file
     * @throws IOException if the file cannot be written
     */
    public void writeReport(RunReport report, Path target) throws IOException {
        writeJson(report, target);
        log.info("Wrote run report for {} to {} ({} failures, {} exclusions)",
            report.repository(), target, report.failures().size(), report.exclusions().size());
    }

    /**
     * Writes the reports of several repositories as one JSON array.
     *
     * @param reports run reports
     * @param target report file
     * @throws IOException if the file cannot be written
     */
    public void writeReports(List<RunReport> reports, Path target) throws IOException {
        writeJson(reports, target);
        log.info("Wrote {} run reports to {}", reports.size(), target);
    }

    /**
     * Renders a value with the dataset mapper.
     *
     * @param value model value
     * @return pretty-printed JSON
     * @throws IOException if the value cannot be serialized
     */
    public String toJson(Object value) throws IOException {
        return DatasetJson.mapper().writeValueAsString(value);
    }

    private void writeJson(Object value, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            DatasetJson.mapper().writeValue(writer, value);
        }
    }
}
