package com.structds.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;

/**
 * Root configuration for dataset runs.
 *
 * <p>Loaded from {@code structds.yaml}. Every section is optional; absent values fall back to
 * the defaults of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * extraction:
 *   workers: 4
 *   timeoutSeconds: 600
 *   exclude:
 *     - ".git/**"
 *     - "build/**"
 *
 * filters:
 *   - NoStringTypeFilter
 *   - EmptyFilter
 *
 * output:
 *   dataset: dataset.json
 *   report: report.json
 * }</pre>
 *
 * @param extraction extraction settings
 * @param filters filter names applied in order
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DatasetConfig(
    @JsonProperty("extraction") ExtractionConfig extraction,
    @JsonProperty("filters") List<String> filters,
    @JsonProperty("output") OutputConfig output
) {
    public DatasetConfig {
        if (extraction == null) {
            extraction = ExtractionConfig.defaults();
        }
        filters = filters != null ? List.copyOf(filters) : List.of();
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    /**
     * Creates the default configuration: one worker per processor, a ten minute timeout,
     * common tool directories excluded, no filters.
     *
     * @return default configuration
     */
    public static DatasetConfig defaults() {
        return new DatasetConfig(ExtractionConfig.defaults(), List.of(), OutputConfig.defaults());
    }

    /**
     * Returns a copy with a different filter chain.
     *
     * @param filterNames filter names in order
     * @return new configuration
     */
    public DatasetConfig withFilters(List<String> filterNames) {
        return new DatasetConfig(extraction, filterNames, output);
    }

    /**
     * Returns a copy with different extraction settings.
     *
     * @param settings extraction settings
     * @return new configuration
     */
    public DatasetConfig withExtraction(ExtractionConfig settings) {
        return new DatasetConfig(settings, filters, output);
    }

    /**
     * Checks value ranges that YAML cannot express.
     *
     * @throws ConfigurationException if workers is below one or the timeout is negative
     */
    public void validate() {
        if (extraction.workers() < 1) {
            throw new ConfigurationException("extraction.workers must be at least 1, got " + extraction.workers());
        }
        if (extraction.timeoutSeconds() < 0) {
            throw new ConfigurationException(
                "extraction.timeoutSeconds must not be negative, got " + extraction.timeoutSeconds());
        }
    }

    /**
     * Extraction settings.
     *
     * @param workers number of parallel extraction workers
     * @param timeoutSeconds bound on the whole extraction, 0 for none
     * @param exclude glob patterns of paths to skip, relative to the repository root
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExtractionConfig(
        @JsonProperty("workers") Integer workers,
        @JsonProperty("timeoutSeconds") Long timeoutSeconds,
        @JsonProperty("exclude") List<String> exclude
    ) {
        public static final long DEFAULT_TIMEOUT_SECONDS = 600;
        public static final List<String> DEFAULT_EXCLUDES = List.of(
            ".git/**",
            "**/.venv/**",
            "**/venv/**",
            "**/__pycache__/**",
            "**/node_modules/**"
        );

        public ExtractionConfig {
            if (workers == null) {
                workers = Runtime.getRuntime().availableProcessors();
            }
            if (timeoutSeconds == null) {
                timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            }
            exclude = exclude != null ? List.copyOf(exclude) : DEFAULT_EXCLUDES;
        }

        public static ExtractionConfig defaults() {
            return new ExtractionConfig(null, null, null);
        }

        /**
         * Gets the timeout as a duration.
         *
         * @return timeout, {@link Duration#ZERO} for none
         */
        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }
    }

    /**
     * Output settings.
     *
     * @param dataset path of the dataset JSON file
     * @param report path of the run report, {@code null} to skip it
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("dataset") String dataset,
        @JsonProperty("report") String report
    ) {
        public static final String DEFAULT_DATASET = "dataset.json";

        public OutputConfig {
            if (dataset == null || dataset.isBlank()) {
                dataset = DEFAULT_DATASET;
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig(DEFAULT_DATASET, null);
        }
    }
}
