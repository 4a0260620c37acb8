package com.structds.core.filter;

import com.structds.core.config.ConfigurationException;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named filter made of one or more scoped steps.
 *
 * <p>All steps of a filter are applied in one traversal. An entity is retained only if every
 * step at its scope retains it.
 *
 * @param name registry name, matched case-insensitively
 * @param description one-line description for listings
 * @param steps scoped steps, at least one
 */
public record DatasetFilter(String name, String description, List<ScopedFilter> steps) {

    public DatasetFilter {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Filter name must not be blank");
        }
        if (steps == null || steps.isEmpty()) {
            throw new ConfigurationException("Filter " + name + " declares no steps");
        }
        steps = List.copyOf(steps);
        description = description != null ? description : "";
    }

    /**
     * Creates a filter from its steps.
     */
    public static DatasetFilter of(String name, String description, ScopedFilter... steps) {
        return new DatasetFilter(name, description, List.of(steps));
    }

    /**
     * Gets the scopes this filter has steps for.
     *
     * @return scopes in tree order
     */
    public Set<FilterScope> scopes() {
        Set<FilterScope> scopes = EnumSet.noneOf(FilterScope.class);
        steps.forEach(step -> scopes.add(step.scope()));
        return scopes;
    }

    /**
     * Returns true if any step applies at the given scope or below it.
     *
     * @param scope tree level
     * @return true if the traversal has to descend to this level
     */
    public boolean reaches(FilterScope scope) {
        return steps.stream().anyMatch(step -> step.scope().compareTo(scope) >= 0);
    }

    /**
     * Gets the display form used in listings, e.g. {@code EmptyFilter [repository, module, class]}.
     *
     * @return name with scopes
     */
    @Override
    public String toString() {
        return name + " " + scopes().toString().toLowerCase();
    }
}
