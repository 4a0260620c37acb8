package com.structds.core.loader;

import com.structds.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Discovers and reads the source files of a repository checkout.
 *
 * <p>Every regular file with the configured extension becomes one {@link SourceUnit}. Files
 * and directories matching an exclude glob are skipped, symbolic links to directories are not
 * followed. Units are returned sorted by relative path, so two runs over the same checkout see
 * the same order regardless of the file system.
 *
 * <p>A file that cannot be read or is not valid UTF-8 is reported as {@link UnreadableSource}
 * and does not stop the walk.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * SourceUnitLoader loader = new SourceUnitLoader("py", List.of(".git/**"));
 * SourceSet sources = loader.load(Path.of("/tmp/checkout"));
 * }</pre>
 */
public class SourceUnitLoader {

    private static final Logger log = LoggerFactory.getLogger(SourceUnitLoader.class);

    private final String extension;
    private final List<PathMatcher> excludes;
    private final List<PathMatcher> excludedDirectories;

    /**
     * Creates a loader.
     *
     * @param extension file extension without the dot (e.g., "py")
     * @param excludeGlobs glob patterns relative to the root for paths to skip
     */
    public SourceUnitLoader(String extension, List<String> excludeGlobs) {
        this.extension = Objects.requireNonNull(extension, "extension must not be null");
        List<String> globs = excludeGlobs != null ? excludeGlobs : List.of();
        this.excludes = FileUtils.globMatchers(globs);
        this.excludedDirectories = FileUtils.directoryMatchers(globs);
    }

    /**
     * Walks the root directory and reads every matching file.
     *
     * @param root repository root
     * @return readable units plus unreadable files
     * @throws UncheckedIOException if the root itself is not a readable directory
     */
    public SourceSet load(Path root) {
        if (!Files.isDirectory(root)) {
            throw new UncheckedIOException(new IOException("Not a directory: " + root));
        }

        List<Path> files = new ArrayList<>();
        List<UnreadableSource> unreadable = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    String relative = FileUtils.relativePath(root, dir);
                    if (FileUtils.matchesAny(excludedDirectories, relative)) {
                        log.debug("Skipping excluded directory: {}", relative);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && extension.equals(FileUtils.getExtension(file))
                            && !FileUtils.matchesAny(excludes, FileUtils.relativePath(root, file))) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    String relative = FileUtils.relativePath(root, file);
                    log.warn("Cannot access {}: {}", relative, e.getMessage());
                    if (extension.equals(FileUtils.getExtension(file))) {
                        unreadable.add(new UnreadableSource(relative, describe(e)));
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + root, e);
        }

        files.sort(Comparator.comparing(file -> FileUtils.relativePath(root, file)));

        List<SourceUnit> units = new ArrayList<>(files.size());
        for (Path file : files) {
            String relative = FileUtils.relativePath(root, file);
            try {
                units.add(new SourceUnit(relative, Files.readString(file, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                log.warn("Failed to read {}: {}", relative, describe(e));
                unreadable.add(new UnreadableSource(relative, describe(e)));
            }
        }
        unreadable.sort(Comparator.comparing(UnreadableSource::filePath));

        log.info("Discovered {} .{} files under {} ({} unreadable)",
            units.size() + unreadable.size(), extension, root, unreadable.size());
        return new SourceSet(units, unreadable);
    }

    private static String describe(IOException e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
