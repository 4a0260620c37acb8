package com.structds.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A class declared at the top level of a module.
 *
 * <p>Superclasses are kept as the base expressions written in the class header. They are never
 * resolved against other classes, so no inheritance graph exists.
 *
 * @param identifier class name
 * @param methods methods in declaration order
 * @param superclasses base class expressions in declaration order
 * @param fields class-level attributes in declaration order
 * @param file path of the declaring module, relative to the repository root
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassDefinition(
    @JsonProperty("identifier") String identifier,
    @JsonProperty("methods") List<MethodDefinition> methods,
    @JsonProperty("superclasses") List<String> superclasses,
    @JsonProperty("fields") List<FieldDescriptor> fields,
    @JsonProperty("file") String file
) {
    public ClassDefinition {
        Objects.requireNonNull(identifier, "identifier must not be null");
        methods = methods != null ? List.copyOf(methods) : List.of();
        superclasses = superclasses != null ? List.copyOf(superclasses) : List.of();
        fields = fields != null ? List.copyOf(fields) : List.of();
    }

    /**
     * Returns a copy of this class holding the given methods.
     *
     * @param retained methods to keep
     * @return this instance if the list is unchanged, a new class otherwise
     */
    public ClassDefinition withMethods(List<MethodDefinition> retained) {
        if (retained.equals(methods)) {
            return this;
        }
        return new ClassDefinition(identifier, retained, superclasses, fields, file);
    }

    /**
     * Finds the initializer of this class.
     *
     * @return the first method flagged as constructor
     */
    public Optional<MethodDefinition> constructor() {
        return methods.stream().filter(MethodDefinition::constructor).findFirst();
    }
}
