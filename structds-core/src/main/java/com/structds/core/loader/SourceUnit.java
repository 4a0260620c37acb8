package com.structds.core.loader;

import java.util.Objects;

/**
 * The text of one source file.
 *
 * @param filePath path relative to the repository root, {@code /}-separated
 * @param text decoded file content
 */
public record SourceUnit(String filePath, String text) {
    public SourceUnit {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }
}
