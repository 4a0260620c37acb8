package com.structds.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How a parameter binds arguments.
 *
 * <p>Bare {@code *} and {@code /} markers in a parameter list are not parameters themselves;
 * they only decide which kind the surrounding parameters get.
 */
public enum ParameterKind {
    /** Declared before a {@code /} marker. */
    @JsonProperty("positional_only")
    POSITIONAL_ONLY,
    /** Ordinary parameter, bindable by position or keyword. */
    @JsonProperty("positional")
    POSITIONAL,
    /** {@code *args}. */
    @JsonProperty("var_positional")
    VAR_POSITIONAL,
    /** Declared after {@code *} or {@code *args}. */
    @JsonProperty("keyword_only")
    KEYWORD_ONLY,
    /** {@code **kwargs}. */
    @JsonProperty("var_keyword")
    VAR_KEYWORD
}
