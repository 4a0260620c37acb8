package com.structds.core.loader;

import java.util.Objects;

/**
 * A file or directory that was discovered but could not be read.
 *
 * @param filePath path relative to the repository root
 * @param message reason reported by the file system or decoder
 */
public record UnreadableSource(String filePath, String message) {
    public UnreadableSource {
        Objects.requireNonNull(filePath, "filePath must not be null");
        if (message == null) {
            message = "unreadable";
        }
    }
}
