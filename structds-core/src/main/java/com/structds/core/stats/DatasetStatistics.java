package com.structds.core.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.structds.core.model.CallableDefinition;
import com.structds.core.model.ClassDefinition;
import com.structds.core.model.Dataset;
import com.structds.core.model.MethodDefinition;
import com.structds.core.model.Repository;
import com.structds.core.model.SourceModule;

import java.util.List;
import java.util.stream.Stream;

/**
 * Entity counts of a dataset, per repository and in total.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * DatasetStatistics stats = DatasetStatistics.of(dataset);
 * stats.repositories().forEach(r -> System.out.println(r.name() + ": " + r.functions()));
 * }</pre>
 *
 * @param repositories counts per repository, in dataset order
 * @param total sum over all repositories
 */
public record DatasetStatistics(
    @JsonProperty("repositories") List<Counts> repositories,
    @JsonProperty("total") Counts total
) {
    private static final String TOTAL = "total";

    public DatasetStatistics {
        repositories = repositories != null ? List.copyOf(repositories) : List.of();
    }

    /**
     * Counts the entities of a dataset.
     *
     * @param dataset dataset to count
     * @return statistics
     */
    public static DatasetStatistics of(Dataset dataset) {
        List<Counts> perRepository = dataset.repositories().stream()
            .map(DatasetStatistics::count)
            .toList();
        Counts total = perRepository.stream()
            .reduce(Counts.zero(TOTAL), Counts::plus);
        return new DatasetStatistics(perRepository, total.named(TOTAL));
    }

    private static Counts count(Repository repository) {
        int classes = 0;
        int functions = 0;
        int methods = 0;
        int constructors = 0;
        int typed = 0;
        int strTyped = 0;
        for (SourceModule module : repository.modules()) {
            classes += module.classes().size();
            functions += module.functions().size();
            for (ClassDefinition type : module.classes()) {
                methods += type.methods().size();
                constructors += (int) type.methods().stream().filter(MethodDefinition::constructor).count();
            }
            List<CallableDefinition> callables = Stream.concat(
                module.functions().stream(),
                module.classes().stream().flatMap(type -> type.methods().stream())
            ).map(CallableDefinition.class::cast).toList();
            for (CallableDefinition callable : callables) {
                if (callable.hasTypeInformation()) {
                    typed++;
                }
                if (callable.hasStrType()) {
                    strTyped++;
                }
            }
        }
        return new Counts(repository.name(), repository.modules().size(), classes, functions, methods,
            constructors, typed, strTyped);
    }

    /**
     * Entity counts of one repository.
     *
     * @param name repository name, or {@code total}
     * @param modules module count
     * @param classes class count
     * @param functions module-level function count
     * @param methods method count
     * @param constructors methods flagged as constructor
     * @param typedCallables functions and methods with at least one declared type
     * @param strTypedCallables functions and methods with a {@code str} parameter or return
     */
    public record Counts(
        @JsonProperty("name") String name,
        @JsonProperty("modules") int modules,
        @JsonProperty("classes") int classes,
        @JsonProperty("functions") int functions,
        @JsonProperty("methods") int methods,
        @JsonProperty("constructors") int constructors,
        @JsonProperty("typed_callables") int typedCallables,
        @JsonProperty("str_typed_callables") int strTypedCallables
    ) {
        static Counts zero(String name) {
            return new Counts(name, 0, 0, 0, 0, 0, 0, 0);
        }

        Counts plus(Counts other) {
            return new Counts(name, modules + other.modules, classes + other.classes,
                functions + other.functions, methods + other.methods, constructors + other.constructors,
                typedCallables + other.typedCallables, strTypedCallables + other.strTypedCallables);
        }

        Counts named(String newName) {
            return new Counts(newName, modules, classes, functions, methods, constructors,
                typedCallables, strTypedCallables);
        }

        /**
         * Gets the number of functions and methods.
         *
         * @return callable count
         */
        public int callables() {
            return functions + methods;
        }
    }
}
