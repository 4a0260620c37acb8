package com.structds.core.config;

/**
 * Thrown when a run is misconfigured: unknown or duplicate filter names, a filter without
 * steps, or invalid extraction settings.
 *
 * <p>Configuration errors are detected before any source file is read and abort the run.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
