package com.structds.core.model;

import java.util.Comparator;
import java.util.List;

/**
 * An ordered collection of repositories, the unit that is written to and read from disk.
 *
 * @param repositories repositories in insertion order
 */
public record Dataset(List<Repository> repositories) {

    public Dataset {
        repositories = repositories != null ? List.copyOf(repositories) : List.of();
    }

    /**
     * Returns a canonically ordered copy for comparisons.
     *
     * <p>Repositories are ordered by name, modules by file path, and functions, classes and
     * methods by identifier. Parameters, superclasses and fields keep their declaration order.
     *
     * @return sorted dataset
     */
    public Dataset sorted() {
        return new Dataset(repositories.stream()
            .map(Dataset::sortRepository)
            .sorted(Comparator.comparing(Repository::name))
            .toList());
    }

    private static Repository sortRepository(Repository repository) {
        List<SourceModule> modules = repository.modules().stream()
            .map(Dataset::sortModule)
            .sorted(Comparator.comparing(SourceModule::filePath))
            .toList();
        return repository.withModules(modules);
    }

    private static SourceModule sortModule(SourceModule module) {
        List<FunctionDefinition> functions = module.functions().stream()
            .sorted(Comparator.comparing(FunctionDefinition::identifier))
            .toList();
        List<ClassDefinition> classes = module.classes().stream()
            .map(cls -> cls.withMethods(cls.methods().stream()
                .sorted(Comparator.comparing(MethodDefinition::identifier))
                .toList()))
            .sorted(Comparator.comparing(ClassDefinition::identifier))
            .toList();
        return module.withChildren(functions, classes);
    }
}
