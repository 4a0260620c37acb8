package com.structds.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One source file of a repository.
 *
 * <p>Holds only the declarations made at the outermost scope of the file. Nested functions and
 * classes are part of the bodies that contain them.
 *
 * @param name dotted module name derived from the file path (e.g., {@code pkg.sub.core})
 * @param filePath path relative to the repository root, {@code /}-separated
 * @param functions top-level functions in declaration order
 * @param classes top-level classes in declaration order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceModule(
    @JsonProperty("name") String name,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("functions") List<FunctionDefinition> functions,
    @JsonProperty("classes") List<ClassDefinition> classes
) {
    public SourceModule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(filePath, "filePath must not be null");
        functions = functions != null ? List.copyOf(functions) : List.of();
        classes = classes != null ? List.copyOf(classes) : List.of();
    }

    /**
     * Returns a copy of this module holding the given children.
     *
     * @param retainedFunctions functions to keep
     * @param retainedClasses classes to keep
     * @return this instance if nothing changed, a new module otherwise
     */
    public SourceModule withChildren(List<FunctionDefinition> retainedFunctions,
                                     List<ClassDefinition> retainedClasses) {
        if (retainedFunctions.equals(functions) && retainedClasses.equals(classes)) {
            return this;
        }
        return new SourceModule(name, filePath, retainedFunctions, retainedClasses);
    }

    /**
     * Returns true if the module declares neither functions nor classes.
     *
     * @return true if empty
     */
    public boolean hasNoDeclarations() {
        return functions.isEmpty() && classes.isEmpty();
    }
}
