package com.structds.core.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Why a source file did not contribute a module.
 */
public enum FailureKind {
    /** The file is not valid source code. */
    @JsonProperty("syntax_error")
    SYNTAX_ERROR,

    /** The file could not be read or decoded. */
    @JsonProperty("io_failure")
    IO_FAILURE,

    /** Extraction did not finish before the run timed out or was interrupted. */
    @JsonProperty("cancelled")
    CANCELLED,

    /** The extractor failed unexpectedly. */
    @JsonProperty("internal_error")
    INTERNAL_ERROR
}
