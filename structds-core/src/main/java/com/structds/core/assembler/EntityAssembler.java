package com.structds.core.assembler;

import com.structds.core.extractor.ParsedSource.ClassRecord;
import com.structds.core.extractor.ParsedSource.FunctionRecord;
import com.structds.core.extractor.ParsedSource.ModuleRecord;
import com.structds.core.model.ClassDefinition;
import com.structds.core.model.FunctionDefinition;
import com.structds.core.model.MethodDefinition;
import com.structds.core.model.Repository;
import com.structds.core.model.RepositoryIdentity;
import com.structds.core.model.SourceModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Folds parsed records into the immutable entity tree.
 *
 * <p>The fold is pure and order preserving. Nothing is renamed, de-duplicated or resolved
 * across modules; the only decisions taken here are the module name, the joined decorator
 * text and the constructor flag.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * EntityAssembler assembler = new EntityAssembler("__init__");
 * Repository repository = assembler.assemble(identity, parsedModules);
 * }</pre>
 */
public class EntityAssembler {

    private static final Logger log = LoggerFactory.getLogger(EntityAssembler.class);

    private final String initializerName;

    /**
     * Creates an assembler.
     *
     * @param initializerName method name that marks a class initializer
     */
    public EntityAssembler(String initializerName) {
        this.initializerName = Objects.requireNonNull(initializerName, "initializerName must not be null");
    }

    /**
     * Builds a repository from parsed modules.
     *
     * @param identity repository identity
     * @param modules parsed modules in discovery order
     * @return assembled repository
     * @throws IllegalArgumentException if two modules share a file path
     */
    public Repository assemble(RepositoryIdentity identity, List<ModuleRecord> modules) {
        Objects.requireNonNull(identity, "identity must not be null");
        List<SourceModule> assembled = modules.stream()
            .map(this::assembleModule)
            .toList();
        log.debug("Assembled repository {} with {} modules", identity.name(), assembled.size());
        return Repository.of(identity, assembled);
    }

    /**
     * Builds a single module.
     *
     * @param module parsed module
     * @return assembled module
     */
    public SourceModule assembleModule(ModuleRecord module) {
        String filePath = module.filePath();
        List<FunctionDefinition> functions = module.functions().stream()
            .map(function -> toFunction(function, filePath))
            .toList();
        List<ClassDefinition> classes = module.classes().stream()
            .map(type -> toClass(type, filePath))
            .toList();
        return new SourceModule(moduleName(filePath), filePath, functions, classes);
    }

    /**
     * Derives the dotted module name from a relative file path.
     *
     * <p>Examples: {@code src/pkg/core.py} gives {@code src.pkg.core},
     * {@code pkg/__init__.py} gives {@code pkg.__init__}.
     *
     * @param filePath {@code /}-separated path relative to the repository root
     * @return dotted module name
     */
    public static String moduleName(String filePath) {
        String withoutExtension = filePath;
        int slash = filePath.lastIndexOf('/');
        int dot = filePath.lastIndexOf('.');
        if (dot > slash + 1) {
            withoutExtension = filePath.substring(0, dot);
        }
        return withoutExtension.replace('/', '.');
    }

    private FunctionDefinition toFunction(FunctionRecord function, String filePath) {
        return new FunctionDefinition(
            function.name(),
            function.parameters(),
            joinDecorators(function.decorators()),
            function.returnType(),
            function.body(),
            filePath,
            function.lineNumber(),
            function.colOffset(),
            function.async()
        );
    }

    private ClassDefinition toClass(ClassRecord type, String filePath) {
        List<MethodDefinition> methods = type.methods().stream()
            .map(this::toMethod)
            .toList();
        return new ClassDefinition(type.name(), methods, type.bases(), type.fields(), filePath);
    }

    private MethodDefinition toMethod(FunctionRecord method) {
        return new MethodDefinition(
            method.name(),
            method.parameters(),
            joinDecorators(method.decorators()),
            method.returnType(),
            method.body(),
            initializerName.equals(method.name()),
            method.lineNumber(),
            method.colOffset(),
            method.async()
        );
    }

    private static String joinDecorators(List<String> decorators) {
        return String.join("\n", decorators);
    }
}
