package com.structds.core.util;

import java.io.File;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private static final String RECURSIVE_SUFFIX = "/**";

    private FileUtils() {
        // Utility class
    }

    /**
     * Compiles glob patterns into path matchers.
     *
     * <p>Example patterns: {@code .git/**}, {@code **}{@code /.venv/**}, {@code docs/*.py}.
     *
     * @param globPatterns glob patterns relative to a root directory
     * @return matchers in pattern order
     */
    public static List<PathMatcher> globMatchers(List<String> globPatterns) {
        return globPatterns.stream()
            .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
            .toList();
    }

    /**
     * Compiles the directory part of recursive glob patterns.
     *
     * <p>A pattern such as {@code build/**} excludes everything below {@code build}, so the
     * directory itself can be skipped without visiting it. Patterns that do not end in
     * {@code /**} contribute nothing.
     *
     * @param globPatterns glob patterns relative to a root directory
     * @return matchers for whole directories
     */
    public static List<PathMatcher> directoryMatchers(List<String> globPatterns) {
        return globMatchers(globPatterns.stream()
            .filter(pattern -> pattern.endsWith(RECURSIVE_SUFFIX))
            .map(pattern -> pattern.substring(0, pattern.length() - RECURSIVE_SUFFIX.length()))
            .filter(pattern -> !pattern.isEmpty())
            .toList());
    }

    /**
     * Checks a relative path against matchers.
     *
     * <p>The path is also tried with a leading separator so that {@code **}{@code /name} patterns
     * match entries directly under the root.
     *
     * @param matchers compiled matchers
     * @param relativePath {@code /}-separated path relative to the root
     * @return true if any matcher accepts the path
     */
    public static boolean matchesAny(List<PathMatcher> matchers, String relativePath) {
        if (matchers.isEmpty() || relativePath.isEmpty()) {
            return false;
        }
        Path path = Path.of(relativePath);
        Path rooted = Path.of("/" + relativePath);
        return matchers.stream().anyMatch(matcher -> matcher.matches(path) || matcher.matches(rooted));
    }

    /**
     * Gets a path relative to a root with {@code /} separators on every platform.
     *
     * @param root root directory
     * @param path path below the root
     * @return relative path, empty for the root itself
     */
    public static String relativePath(Path root, Path path) {
        return root.relativize(path).toString().replace(File.separatorChar, '/');
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(lastDot + 1) : "";
    }
}
