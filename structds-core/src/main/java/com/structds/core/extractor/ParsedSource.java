package com.structds.core.extractor;

import com.structds.core.model.FieldDescriptor;
import com.structds.core.model.Parameter;

import java.util.List;
import java.util.Objects;

/**
 * Intermediate records produced by a {@link SourceExtractor} for one file.
 *
 * <p>These records carry everything the {@link com.structds.core.assembler.EntityAssembler} needs to
 * build the entity model: decorators are still a list and the constructor flag is not decided yet.
 *
 * @see SourceExtractor
 */
public final class ParsedSource {

    private ParsedSource() {
        // Utility class - no instantiation
    }

    /**
     * Outermost declarations of one file.
     *
     * @param filePath path relative to the repository root
     * @param functions top-level functions in source order
     * @param classes top-level classes in source order
     */
    public record ModuleRecord(
        String filePath,
        List<FunctionRecord> functions,
        List<ClassRecord> classes
    ) {
        public ModuleRecord {
            Objects.requireNonNull(filePath, "filePath must not be null");
            functions = functions != null ? List.copyOf(functions) : List.of();
            classes = classes != null ? List.copyOf(classes) : List.of();
        }
    }

    /**
     * A function or method declaration.
     *
     * <p>Example:
     * <pre>{@code
     * @cache
     * async def load(self, key: str) -> bytes:
     *     ...
     * }</pre>
     *
     * @param name declared identifier
     * @param parameters parameters in declaration order
     * @param decorators decorator text in source order, each starting with {@code @}
     * @param returnType return annotation as written, or {@code null}
     * @param body body text without the header
     * @param lineNumber 1-based line of {@code def}
     * @param colOffset 1-based column of the name
     * @param async whether declared with {@code async def}
     */
    public record FunctionRecord(
        String name,
        List<Parameter> parameters,
        List<String> decorators,
        String returnType,
        String body,
        int lineNumber,
        int colOffset,
        boolean async
    ) {
        public FunctionRecord {
            Objects.requireNonNull(name, "name must not be null");
            parameters = parameters != null ? List.copyOf(parameters) : List.of();
            decorators = decorators != null ? List.copyOf(decorators) : List.of();
            body = body != null ? body : "";
        }
    }

    /**
     * A class declaration.
     *
     * @param name declared identifier
     * @param bases positional base expressions in order
     * @param fields class-level attributes in order
     * @param methods functions declared directly in the class body
     * @param decorators decorator text in source order
     * @param lineNumber 1-based line of {@code class}
     */
    public record ClassRecord(
        String name,
        List<String> bases,
        List<FieldDescriptor> fields,
        List<FunctionRecord> methods,
        List<String> decorators,
        int lineNumber
    ) {
        public ClassRecord {
            Objects.requireNonNull(name, "name must not be null");
            bases = bases != null ? List.copyOf(bases) : List.of();
            fields = fields != null ? List.copyOf(fields) : List.of();
            methods = methods != null ? List.copyOf(methods) : List.of();
            decorators = decorators != null ? List.copyOf(decorators) : List.of();
        }
    }
}
