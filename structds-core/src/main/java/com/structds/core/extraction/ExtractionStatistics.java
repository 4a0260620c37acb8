package com.structds.core.extraction;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics collected during one extraction run.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ExtractionStatistics stats = new ExtractionStatistics.Builder()
 *     .filesDiscovered(120)
 *     .incrementFilesParsed()
 *     .incrementFilesFailed()
 *     .addError("SYNTAX_ERROR", "pkg/legacy.py:3:7: invalid syntax")
 *     .build();
 * }</pre>
 *
 * @param filesDiscovered source files found by the loader, readable or not
 * @param filesParsed files that produced a module
 * @param filesFailed files that produced a failure instead
 * @param errorCounts number of failures per failure kind
 * @param topErrors first failure descriptions (max 10)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionStatistics(
    @JsonProperty("files_discovered") int filesDiscovered,
    @JsonProperty("files_parsed") int filesParsed,
    @JsonProperty("files_failed") int filesFailed,
    @JsonProperty("error_counts") Map<String, Integer> errorCounts,
    @JsonProperty("top_errors") List<String> topErrors
) {
    private static final int MAX_TOP_ERRORS = 10;

    /**
     * Compact constructor with validation and defaults.
     */
    public ExtractionStatistics {
        if (filesDiscovered < 0) {
            filesDiscovered = 0;
        }
        if (filesParsed < 0) {
            filesParsed = 0;
        }
        if (filesFailed < 0) {
            filesFailed = 0;
        }
        errorCounts = errorCounts != null ? Map.copyOf(errorCounts) : Map.of();
        topErrors = topErrors != null ? List.copyOf(topErrors) : List.of();
    }

    /**
     * Creates an empty statistics instance (no files processed).
     *
     * @return empty statistics
     */
    public static ExtractionStatistics empty() {
        return new ExtractionStatistics(0, 0, 0, Map.of(), List.of());
    }

    /**
     * Calculates the share of discovered files that produced a module.
     *
     * @return success rate as percentage (0.0 to 100.0), or 0 if no files were discovered
     */
    @JsonIgnore
    public double getSuccessRate() {
        if (filesDiscovered == 0) {
            return 0.0;
        }
        return (filesParsed * 100.0) / filesDiscovered;
    }

    /**
     * Returns true if at least one file failed.
     *
     * @return true if any file failed
     */
    public boolean hasFailures() {
        return filesFailed > 0;
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    @JsonIgnore
    public String getSummary() {
        return String.format(
            "Discovered: %d, Parsed: %d (%.1f%%), Failed: %d %s",
            filesDiscovered,
            filesParsed,
            getSuccessRate(),
            filesFailed,
            errorCounts.isEmpty() ? "" : errorCounts
        ).trim();
    }

    /**
     * Builder for constructing ExtractionStatistics incrementally.
     */
    public static class Builder {
        private int filesDiscovered = 0;
        private int filesParsed = 0;
        private int filesFailed = 0;
        private final Map<String, Integer> errorCounts = new HashMap<>();
        private final List<String> topErrors = new ArrayList<>();

        public Builder filesDiscovered(int count) {
            this.filesDiscovered = count;
            return this;
        }

        public Builder incrementFilesParsed() {
            this.filesParsed++;
            return this;
        }

        public Builder incrementFilesFailed() {
            this.filesFailed++;
            return this;
        }

        public Builder addError(String errorType, String errorDetail) {
            errorCounts.merge(errorType, 1, Integer::sum);
            if (topErrors.size() < MAX_TOP_ERRORS) {
                topErrors.add(errorDetail);
            }
            return this;
        }

        public ExtractionStatistics build() {
            return new ExtractionStatistics(
                filesDiscovered,
                filesParsed,
                filesFailed,
                errorCounts,
                topErrors
            );
        }
    }
}
