package com.structds.core.serializer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.structds.core.extraction.ExtractionFailure;
import com.structds.core.extraction.ExtractionStatistics;
import com.structds.core.filter.FilterExclusion;

import java.util.List;
import java.util.Objects;

/**
 * Audit record of one run, written next to the dataset.
 *
 * <p>Keeps files that failed to parse apart from entities a filter excluded, so a consumer can
 * tell why something is missing from the dataset.
 *
 * @param repository repository name
 * @param filters filter chain that was applied
 * @param statistics extraction statistics
 * @param failures files that did not produce a module
 * @param exclusions entities removed by filters
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunReport(
    @JsonProperty("repository") String repository,
    @JsonProperty("filters") List<String> filters,
    @JsonProperty("statistics") ExtractionStatistics statistics,
    @JsonProperty("failures") List<ExtractionFailure> failures,
    @JsonProperty("exclusions") List<FilterExclusion> exclusions
) {
    public RunReport {
        Objects.requireNonNull(repository, "repository must not be null");
        filters = filters != null ? List.copyOf(filters) : List.of();
        if (statistics == null) {
            statistics = ExtractionStatistics.empty();
        }
        failures = failures != null ? List.copyOf(failures) : List.of();
        exclusions = exclusions != null ? List.copyOf(exclusions) : List.of();
    }
}
