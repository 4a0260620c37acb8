package com.structds.core.filter;

/**
 * Entity granularity a filter step is evaluated at, coarsest first.
 */
public enum FilterScope {
    REPOSITORY,
    MODULE,
    CLASS,
    /** Module functions and class methods alike. */
    FUNCTION
}
