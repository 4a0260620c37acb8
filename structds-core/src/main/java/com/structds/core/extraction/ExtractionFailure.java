package com.structds.core.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.structds.core.extractor.SourceSyntaxException;

import java.util.Objects;

/**
 * A source file that was excluded from the dataset because it could not be processed.
 *
 * @param filePath path relative to the repository root
 * @param kind failure category
 * @param message diagnostic
 * @param line 1-based line of a syntax error, 0 when unknown
 * @param column 1-based column of a syntax error, 0 when unknown
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionFailure(
    @JsonProperty("file_path") String filePath,
    @JsonProperty("kind") FailureKind kind,
    @JsonProperty("message") String message,
    @JsonProperty("line") int line,
    @JsonProperty("column") int column
) {
    public ExtractionFailure {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (message == null) {
            message = "";
        }
    }

    /**
     * Creates a failure without a source position.
     */
    public static ExtractionFailure of(String filePath, FailureKind kind, String message) {
        return new ExtractionFailure(filePath, kind, message, 0, 0);
    }

    /**
     * Creates a failure from a parse error.
     */
    public static ExtractionFailure syntaxError(SourceSyntaxException e) {
        return new ExtractionFailure(e.getFilePath(), FailureKind.SYNTAX_ERROR, e.getDiagnostic(),
            e.getLine(), e.getColumn());
    }

    /**
     * Formats the failure for logs, e.g. {@code pkg/bad.py:3:5: SYNTAX_ERROR invalid syntax}.
     *
     * @return one-line description
     */
    public String describe() {
        String position = line > 0 ? ":" + line + ":" + column : "";
        return filePath + position + ": " + kind + " " + message;
    }
}
