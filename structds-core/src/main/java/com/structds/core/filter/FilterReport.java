package com.structds.core.filter;

import com.structds.core.model.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Output of a filter chain run on one repository.
 *
 * @param repository pruned repository, or {@code null} if a filter removed it
 * @param exclusions removed entities, in the order the filters removed them
 */
public record FilterReport(Repository repository, List<FilterExclusion> exclusions) {

    public FilterReport {
        exclusions = exclusions != null ? List.copyOf(exclusions) : List.of();
    }

    /**
     * Gets the pruned repository if it survived the chain.
     *
     * @return pruned repository
     */
    public Optional<Repository> retained() {
        return Optional.ofNullable(repository);
    }
}
