package com.structds.core.stats;

import com.structds.core.stats.DatasetStatistics.Counts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Exports {@link DatasetStatistics} as a LaTeX {@code tabular}.
 *
 * <p>The surrounding table comes from the {@code templates/tex-table.tex} resource; one row per
 * repository replaces its {@code {rows}} placeholder, followed by a total row when the dataset
 * holds more than one repository. Repository names are escaped for LaTeX.
 */
public class LatexTableWriter {

    private static final Logger log = LoggerFactory.getLogger(LatexTableWriter.class);

    static final String TEMPLATE = "templates/tex-table.tex";
    static final String ROWS_PLACEHOLDER = "{rows}";

    private static final String INDENT = "    ";
    private static final String CELL_SEPARATOR = " & ";
    private static final String ROW_END = " \\\\\n";

    /**
     * Renders the complete table.
     *
     * @param stats statistics to render
     * @return LaTeX source
     */
    public String render(DatasetStatistics stats) {
        StringBuilder rows = new StringBuilder();
        stats.repositories().forEach(counts -> appendRow(rows, counts));
        if (stats.repositories().size() > 1) {
            rows.append(INDENT).append("\\midrule\n");
            appendRow(rows, stats.total());
        }
        return loadTemplate().replace(ROWS_PLACEHOLDER, rows);
    }

    /**
     * Writes the table to a file, creating parent directories as needed.
     *
     * @param stats statistics to render
     * @param target output file
     * @throws IOException if the file cannot be written
     */
    public void write(DatasetStatistics stats, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, render(stats), StandardCharsets.UTF_8);
        log.info("Wrote LaTeX table to {}", target);
    }

    private static void appendRow(StringBuilder rows, Counts counts) {
        rows.append(INDENT)
            .append(escape(counts.name())).append(CELL_SEPARATOR)
            .append(counts.modules()).append(CELL_SEPARATOR)
            .append(counts.classes()).append(CELL_SEPARATOR)
            .append(counts.functions()).append(CELL_SEPARATOR)
            .append(counts.methods()).append(CELL_SEPARATOR)
            .append(counts.constructors()).append(CELL_SEPARATOR)
            .append(counts.typedCallables()).append(CELL_SEPARATOR)
            .append(counts.strTypedCallables())
            .append(ROW_END);
    }

    /**
     * Escapes the characters LaTeX treats specially in text mode.
     */
    static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> escaped.append("\\textbackslash{}");
                case '~' -> escaped.append("\\textasciitilde{}");
                case '^' -> escaped.append("\\textasciicircum{}");
                case '&', '%', '$', '#', '_', '{', '}' -> escaped.append('\\').append(c);
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    private static String loadTemplate() {
        try (InputStream in = LatexTableWriter.class.getClassLoader().getResourceAsStream(TEMPLATE)) {
            if (in == null) {
                throw new IOException("Resource not found: " + TEMPLATE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
