package com.structds.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A class-level attribute assigned directly in a class body.
 *
 * @param name attribute name
 * @param type declared annotation, or {@code null}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldDescriptor(
    @JsonProperty("name") String name,
    @JsonProperty("type") String type
) {
    public FieldDescriptor {
        Objects.requireNonNull(name, "name must not be null");
    }
}
