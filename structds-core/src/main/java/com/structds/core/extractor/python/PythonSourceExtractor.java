package com.structds.core.extractor.python;

import com.structds.core.extractor.ParsedSource;
import com.structds.core.extractor.SourceExtractor;
import com.structds.core.extractor.SourceSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Structural extractor for Python source files.
 *
 * <p>Parses with the ANTLR-generated {@code Python3Parser} and extracts top-level functions and
 * classes, class methods, class-level fields and base classes, decorators, parameter lists with
 * kinds and annotations, return annotations and the source text of every body.
 *
 * <p><b>Supported constructs:</b>
 * <ul>
 *   <li>{@code def} and {@code async def}, with positional-only, keyword-only and variadic
 *       parameters</li>
 *   <li>{@code class} with positional bases, keyword arguments are ignored</li>
 *   <li>decorators of any expression form</li>
 *   <li>PEP 695 type parameter lists and type aliases, match statements and assignment
 *       expressions</li>
 * </ul>
 *
 * <p>Python 2 only syntax such as {@code print "x"} is rejected like any other syntax error.
 *
 * <p>Line endings are normalized to LF and a leading byte order mark is dropped before
 * lexing, so bodies and positions are the same for CRLF and LF checkouts.
 *
 * @see PythonStructureCollector
 * @see SyntaxErrorListener
 */
public class PythonSourceExtractor implements SourceExtractor {

    private static final Logger log = LoggerFactory.getLogger(PythonSourceExtractor.class);

    private static final String LANGUAGE = "python";
    private static final String FILE_EXTENSION = "py";
    private static final String INITIALIZER_NAME = "__init__";

    @Override
    public String getLanguage() {
        return LANGUAGE;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public String getInitializerName() {
        return INITIALIZER_NAME;
    }

    @Override
    public ParsedSource.ModuleRecord extract(String filePath, String text) throws SourceSyntaxException {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(text, "text must not be null");

        PythonSyntaxTree tree = PythonSyntaxTree.parse(filePath, normalizeLineEndings(text));
        ParsedSource.ModuleRecord module = new PythonStructureCollector(filePath, tree).collect();

        log.debug("Extracted {} functions and {} classes from {}",
            module.functions().size(), module.classes().size(), filePath);
        return module;
    }

    @Override
    public String removeTypeAnnotations(String filePath, String text) throws SourceSyntaxException {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(text, "text must not be null");

        return TypeAnnotationRemover.strip(PythonSyntaxTree.parse(filePath, normalizeLineEndings(text)));
    }

    static String normalizeLineEndings(String text) {
        String result = text;
        if (!result.isEmpty() && result.charAt(0) == '\uFEFF') {
            result = result.substring(1);
        }
        return result.replace("\r\n", "\n").replace('\r', '\n');
    }
}
