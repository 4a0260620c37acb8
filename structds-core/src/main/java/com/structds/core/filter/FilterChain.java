package com.structds.core.filter;

import com.structds.core.model.Dataset;
import com.structds.core.model.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An ordered sequence of resolved filters.
 *
 * <p>Each filter sees only what the filters before it retained. Applying a chain never
 * modifies its input; subtrees that no filter touched are shared between input and output.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * FilterChain chain = FilterRegistry.defaults().resolve("NoStringTypeFilter,EmptyFilter");
 * Optional<Repository> typed = chain.apply(repository);
 * }</pre>
 *
 * @see FilterRegistry#resolve(List)
 */
public final class FilterChain {

    private static final Logger log = LoggerFactory.getLogger(FilterChain.class);

    private static final FilterChain EMPTY = new FilterChain(List.of());

    private final List<DatasetFilter> filters;

    private FilterChain(List<DatasetFilter> filters) {
        this.filters = List.copyOf(filters);
    }

    /**
     * Creates a chain from already resolved filters.
     *
     * @param filters filters in application order
     * @return new chain
     */
    public static FilterChain of(List<DatasetFilter> filters) {
        Objects.requireNonNull(filters, "filters must not be null");
        return filters.isEmpty() ? EMPTY : new FilterChain(filters);
    }

    /**
     * Creates a chain from already resolved filters.
     */
    public static FilterChain of(DatasetFilter... filters) {
        return of(List.of(filters));
    }

    /**
     * Gets the chain that retains everything.
     *
     * @return empty chain
     */
    public static FilterChain empty() {
        return EMPTY;
    }

    public List<DatasetFilter> filters() {
        return filters;
    }

    public List<String> names() {
        return filters.stream().map(DatasetFilter::name).toList();
    }

    public boolean isEmpty() {
        return filters.isEmpty();
    }

    /**
     * Applies every filter to a repository.
     *
     * @param repository input tree
     * @return pruned repository, or empty if a repository step removed it
     */
    public Optional<Repository> apply(Repository repository) {
        return applyWithReport(repository).retained();
    }

    /**
     * Applies every filter to each repository of a dataset, dropping removed repositories.
     *
     * @param dataset input dataset
     * @return pruned dataset
     */
    public Dataset apply(Dataset dataset) {
        List<Repository> retained = new ArrayList<>(dataset.repositories().size());
        for (Repository repository : dataset.repositories()) {
            apply(repository).ifPresent(retained::add);
        }
        return new Dataset(retained);
    }

    /**
     * Applies every filter to a repository and records what was removed.
     *
     * @param repository input tree
     * @return pruned repository and exclusions
     */
    public FilterReport applyWithReport(Repository repository) {
        Objects.requireNonNull(repository, "repository must not be null");
        List<FilterExclusion> exclusions = new ArrayList<>();
        Repository current = repository;
        for (DatasetFilter filter : filters) {
            int before = exclusions.size();
            Optional<Repository> pruned = TreePruner.prune(current, filter, exclusions);
            log.debug("{} removed {} entities from {}", filter.name(), exclusions.size() - before, repository.name());
            if (pruned.isEmpty()) {
                return new FilterReport(null, exclusions);
            }
            current = pruned.get();
        }
        return new FilterReport(current, exclusions);
    }

    @Override
    public String toString() {
        return String.join(",", names());
    }
}
