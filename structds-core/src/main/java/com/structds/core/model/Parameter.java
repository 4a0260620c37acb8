package com.structds.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single declared parameter of a function or method.
 *
 * <p>The position is the 1-based line and 1-based column of the parameter name, which is where
 * an editor cursor would sit. It is kept so pruned output can be anchored back to the source.
 *
 * @param identifier parameter name without {@code *}/{@code **} prefixes
 * @param type declared type annotation as written, or {@code null} if unannotated
 * @param lineNumber 1-based line of the parameter name
 * @param colOffset 1-based column of the parameter name
 * @param kind binding kind, {@link ParameterKind#POSITIONAL} when absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Parameter(
    @JsonProperty("identifier") String identifier,
    @JsonProperty("type") String type,
    @JsonProperty("line_number") int lineNumber,
    @JsonProperty("col_offset") int colOffset,
    @JsonProperty("kind") ParameterKind kind
) {
    public Parameter {
        Objects.requireNonNull(identifier, "identifier must not be null");
        if (kind == null) {
            kind = ParameterKind.POSITIONAL;
        }
    }

    /**
     * Creates an ordinary positional parameter.
     */
    public static Parameter positional(String identifier, String type, int lineNumber, int colOffset) {
        return new Parameter(identifier, type, lineNumber, colOffset, ParameterKind.POSITIONAL);
    }

    /**
     * Returns true if a type annotation was declared.
     *
     * @return true if {@link #type()} is present
     */
    public boolean hasDeclaredType() {
        return type != null;
    }
}
