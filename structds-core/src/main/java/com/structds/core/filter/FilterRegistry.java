package com.structds.core.filter;

import com.structds.core.config.ConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mapping from filter names to filters.
 *
 * <p>A registry is built once and handed to whoever resolves filter chains; there is no
 * global instance. Names are matched case-insensitively.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * FilterRegistry registry = FilterRegistry.builder()
 *     .registerAll(BuiltinFilters.all())
 *     .register(DatasetFilter.of("NoDunderFilter", "drops dunder methods",
 *         new ScopedFilter.FunctionFilter((f, ctx) -> !f.identifier().startsWith("__"))))
 *     .build();
 * FilterChain chain = registry.resolve(List.of("NoDunderFilter", "EmptyFilter"));
 * }</pre>
 */
public final class FilterRegistry {

    private final Map<String, DatasetFilter> filters;

    private FilterRegistry(Map<String, DatasetFilter> filters) {
        this.filters = filters;
    }

    /**
     * Creates a registry holding the built-in filters.
     *
     * @return default registry
     */
    public static FilterRegistry defaults() {
        return builder().registerAll(BuiltinFilters.all()).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up one filter.
     *
     * @param name filter name, any case
     * @return the filter, if registered
     */
    public Optional<DatasetFilter> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(filters.get(key(name)));
    }

    /**
     * Gets all registered filters in registration order.
     *
     * @return registered filters
     */
    public List<DatasetFilter> filters() {
        return List.copyOf(filters.values());
    }

    /**
     * Resolves a chain of filter names.
     *
     * <p>The whole chain is validated before anything is returned. Blank entries are ignored.
     *
     * @param names filter names in application order
     * @return resolved chain
     * @throws ConfigurationException naming every unknown filter
     */
    public FilterChain resolve(List<String> names) {
        Objects.requireNonNull(names, "names must not be null");
        List<DatasetFilter> resolved = new ArrayList<>(names.size());
        List<String> unknown = new ArrayList<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            Optional<DatasetFilter> filter = find(name);
            if (filter.isPresent()) {
                resolved.add(filter.get());
            } else {
                unknown.add(name.trim());
            }
        }
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("Unknown filter" + (unknown.size() > 1 ? "s" : "") + ": "
                + String.join(", ", unknown) + ". Available filters: " + String.join(", ", names()));
        }
        return FilterChain.of(resolved);
    }

    /**
     * Resolves a comma-separated chain of filter names, e.g. {@code "TestModuleFilter,EmptyFilter"}.
     *
     * @param commaSeparated filter names separated by commas
     * @return resolved chain
     * @throws ConfigurationException naming every unknown filter
     */
    public FilterChain resolve(String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isBlank()) {
            return FilterChain.empty();
        }
        return resolve(Arrays.asList(commaSeparated.split(",")));
    }

    private List<String> names() {
        return filters.values().stream().map(DatasetFilter::name).toList();
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Builder for registries.
     */
    public static final class Builder {
        private final Map<String, DatasetFilter> filters = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds a filter.
         *
         * @throws ConfigurationException if a filter with the same name, in any case, exists
         */
        public Builder register(DatasetFilter filter) {
            Objects.requireNonNull(filter, "filter must not be null");
            DatasetFilter previous = filters.putIfAbsent(key(filter.name()), filter);
            if (previous != null) {
                throw new ConfigurationException("Duplicate filter name: " + filter.name()
                    + " (already registered as " + previous.name() + ")");
            }
            return this;
        }

        public Builder registerAll(List<DatasetFilter> additions) {
            additions.forEach(this::register);
            return this;
        }

        public FilterRegistry build() {
            return new FilterRegistry(new LinkedHashMap<>(filters));
        }
    }
}
