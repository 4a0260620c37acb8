package com.structds.core.serializer;

import com.structds.core.extractor.SourceExtractor;
import com.structds.core.extractor.SourceSyntaxException;
import com.structds.core.model.CallableDefinition;
import com.structds.core.model.ClassDefinition;
import com.structds.core.model.Dataset;
import com.structds.core.model.FunctionDefinition;
import com.structds.core.model.MethodDefinition;
import com.structds.core.model.Repository;
import com.structds.core.model.SourceModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Writes every callable of a dataset as a standalone source file.
 *
 * <p>Layout below the output directory:
 * <pre>
 * &lt;repository&gt;/&lt;module&gt;/&lt;function&gt;.py
 * &lt;repository&gt;/&lt;module&gt;/&lt;Class&gt;/&lt;method&gt;.py
 * </pre>
 *
 * <p>Each file holds the decorators, the {@code def} or {@code async def} line rebuilt from the
 * normalized signature and the body exactly as extracted. A name declared twice in the same scope
 * gets the line number appended to its file name.
 *
 * <p>An exporter created with {@link #withoutTypeAnnotations(SourceExtractor)} rewrites each file
 * without parameter, return and variable annotations. A callable whose rendered source cannot be
 * parsed is written with its annotations and a warning is logged.
 */
public class CallableExporter {

    private static final Logger log = LoggerFactory.getLogger(CallableExporter.class);

    private static final String EXTENSION = ".py";

    private final SourceExtractor annotationStripper;

    /**
     * Creates an exporter that writes callables with their annotations.
     */
    public CallableExporter() {
        this(null);
    }

    private CallableExporter(SourceExtractor annotationStripper) {
        this.annotationStripper = annotationStripper;
    }

    /**
     * Creates an exporter that strips type annotations from every written callable.
     *
     * @param extractor extractor of the dataset's language, used to rewrite the source
     * @return exporter without type annotations
     */
    public static CallableExporter withoutTypeAnnotations(SourceExtractor extractor) {
        return new CallableExporter(Objects.requireNonNull(extractor, "extractor must not be null"));
    }

    /**
     * Exports all callables of a dataset.
     *
     * @param dataset dataset to export
     * @param outputDirectory target directory, created if missing
     * @return number of files written
     * @throws IOException if a file cannot be written
     */
    public int export(Dataset dataset, Path outputDirectory) throws IOException {
        Files.createDirectories(outputDirectory);
        Set<Path> written = new HashSet<>();
        for (Repository repository : dataset.repositories()) {
            Path repositoryDir = outputDirectory.resolve(safeName(repository.name()));
            for (SourceModule module : repository.modules()) {
                Path moduleDir = repositoryDir.resolve(safeName(module.name()));
                for (FunctionDefinition function : module.functions()) {
                    writeCallable(moduleDir, function, written);
                }
                for (ClassDefinition type : module.classes()) {
                    Path classDir = moduleDir.resolve(safeName(type.identifier()));
                    for (MethodDefinition method : type.methods()) {
                        writeCallable(classDir, method, written);
                    }
                }
            }
        }
        log.info("Exported {} callables to {}", written.size(), outputDirectory);
        return written.size();
    }

    /**
     * Renders one callable as source text.
     *
     * @param callable function or method
     * @return decorators, {@code def} line and body
     */
    public static String render(CallableDefinition callable) {
        StringBuilder source = new StringBuilder();
        if (!callable.annotations().isEmpty()) {
            source.append(callable.annotations()).append('\n');
        }
        if (callable.async()) {
            source.append("async ");
        }
        source.append("def ").append(callable.signature()).append(':');

        String body = callable.body();
        if (body.isBlank()) {
            source.append(" pass");
        } else if (Character.isWhitespace(body.charAt(0))) {
            source.append('\n').append(body);
        } else {
            source.append(' ').append(body);
        }
        return source.append('\n').toString();
    }

    private void writeCallable(Path directory, CallableDefinition callable, Set<Path> written) throws IOException {
        Path target = directory.resolve(safeName(callable.identifier()) + EXTENSION);
        if (written.contains(target)) {
            target = directory.resolve(safeName(callable.identifier()) + "_" + callable.lineNumber() + EXTENSION);
        }
        Files.createDirectories(directory);
        Files.writeString(target, source(target, callable), StandardCharsets.UTF_8);
        written.add(target);
        log.debug("Wrote {}", target);
    }

    private String source(Path target, CallableDefinition callable) {
        String source = render(callable);
        if (annotationStripper == null) {
            return source;
        }
        try {
            return annotationStripper.removeTypeAnnotations(target.getFileName().toString(), source);
        } catch (SourceSyntaxException e) {
            log.warn("Keeping type annotations of {}: {}", target, e.getMessage());
            return source;
        }
    }

    private static String safeName(String name) {
        String safe = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return safe.isEmpty() || safe.equals(".") || safe.equals("..") ? "_" : safe;
    }
}
