package com.structds.core.extractor;

/**
 * Language-specific structural analysis of a single source file.
 *
 * <p>An extractor only reads text. It never evaluates, imports or type-checks the code, and it
 * holds no mutable state, so one instance may be shared by concurrent workers.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * SourceExtractor extractor = new PythonSourceExtractor();
 * ParsedSource.ModuleRecord module = extractor.extract("pkg/util.py", text);
 * module.functions().forEach(f -> System.out.println(f.name()));
 * }</pre>
 *
 * @see com.structds.core.extractor.python.PythonSourceExtractor
 */
public interface SourceExtractor {

    /**
     * Gets the language this extractor supports.
     *
     * @return language identifier (e.g., "python")
     */
    String getLanguage();

    /**
     * Gets the file extension of source units, without the dot.
     *
     * @return file extension (e.g., "py")
     */
    String getFileExtension();

    /**
     * Gets the reserved name of a class initializer.
     *
     * @return initializer identifier (e.g., "__init__")
     */
    String getInitializerName();

    /**
     * Parses one file.
     *
     * @param filePath path relative to the repository root, used for diagnostics
     * @param text complete file content
     * @return outermost declarations of the file
     * @throws SourceSyntaxException if the text is not valid source code
     */
    ParsedSource.ModuleRecord extract(String filePath, String text) throws SourceSyntaxException;

    /**
     * Rewrites a snippet without its type annotations: parameter annotations, return annotations
     * and the annotations of annotated assignments. All other text is kept as written.
     *
     * @param filePath name used for diagnostics
     * @param text complete, parseable source
     * @return source without type annotations
     * @throws SourceSyntaxException if the text is not valid source code
     */
    String removeTypeAnnotations(String filePath, String text) throws SourceSyntaxException;
}
