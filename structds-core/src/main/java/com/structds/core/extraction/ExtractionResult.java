package com.structds.core.extraction;

import com.structds.core.model.Repository;

import java.util.List;
import java.util.Objects;

/**
 * Result of extracting one repository.
 *
 * @param repository assembled repository holding every file that parsed
 * @param failures files that did not contribute a module, ordered by path
 * @param statistics run statistics
 */
public record ExtractionResult(
    Repository repository,
    List<ExtractionFailure> failures,
    ExtractionStatistics statistics
) {
    /**
     * Compact constructor with validation.
     */
    public ExtractionResult {
        Objects.requireNonNull(repository, "repository must not be null");
        if (failures == null) {
            failures = List.of();
        } else {
            failures = List.copyOf(failures);
        }
        if (statistics == null) {
            statistics = ExtractionStatistics.empty();
        }
    }

    /**
     * Returns true if any file failed.
     *
     * @return true if failures were recorded
     */
    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
