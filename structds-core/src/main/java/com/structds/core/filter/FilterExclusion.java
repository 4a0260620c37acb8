package com.structds.core.filter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * An entity removed by a filter.
 *
 * <p>Paths identify the entity inside its repository: {@code pkg/util.py} for a module,
 * {@code pkg/util.py::Parser} for a class, {@code pkg/util.py::Parser.parse} for a method and
 * {@code pkg/util.py::helper} for a function. A repository exclusion has an empty path.
 *
 * @param filter name of the filter that removed the entity
 * @param scope level of the removed entity
 * @param repository repository name
 * @param path entity path within the repository
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FilterExclusion(
    @JsonProperty("filter") String filter,
    @JsonProperty("scope") FilterScope scope,
    @JsonProperty("repository") String repository,
    @JsonProperty("path") String path
) {
    public FilterExclusion {
        Objects.requireNonNull(filter, "filter must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(repository, "repository must not be null");
        path = path != null ? path : "";
    }
}
