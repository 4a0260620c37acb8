package com.structds.core.filter;

import com.structds.core.filter.ScopedFilter.ClassFilter;
import com.structds.core.filter.ScopedFilter.FunctionFilter;
import com.structds.core.filter.ScopedFilter.ModuleFilter;
import com.structds.core.filter.ScopedFilter.RepositoryFilter;
import com.structds.core.model.CallableDefinition;
import com.structds.core.model.ClassDefinition;
import com.structds.core.model.FunctionDefinition;
import com.structds.core.model.MethodDefinition;
import com.structds.core.model.Repository;
import com.structds.core.model.SourceModule;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies one {@link DatasetFilter} to one repository tree.
 *
 * <p>The traversal descends from the repository to the functions, but only as deep as the
 * filter has steps; levels below the deepest step are shared with the input tree. A node is
 * judged after its children have been pruned by the same filter, so a class that loses all its
 * methods is seen as empty by a class step of the same filter. Unchanged nodes are returned as
 * the same instances.
 *
 * <p>Only the outermost removed node is reported: when a module is dropped, the exclusions of
 * its functions and classes recorded while pruning it are discarded.
 */
final class TreePruner {

    private final DatasetFilter filter;
    private final List<FilterExclusion> exclusions;

    private TreePruner(DatasetFilter filter, List<FilterExclusion> exclusions) {
        this.filter = filter;
        this.exclusions = exclusions;
    }

    /**
     * Prunes a repository.
     *
     * @param repository input tree, left untouched
     * @param filter filter to apply
     * @param exclusions receives one record per removed entity
     * @return pruned repository, or empty if the repository itself was removed
     */
    static Optional<Repository> prune(Repository repository, DatasetFilter filter, List<FilterExclusion> exclusions) {
        return new TreePruner(filter, exclusions).pruneRepository(repository);
    }

    private Optional<Repository> pruneRepository(Repository repository) {
        int mark = exclusions.size();
        Repository pruned = repository;
        FilterContext context = FilterContext.of(repository);

        if (filter.reaches(FilterScope.MODULE)) {
            List<SourceModule> modules = new ArrayList<>(repository.modules().size());
            for (SourceModule module : repository.modules()) {
                pruneModule(module, context).ifPresent(modules::add);
            }
            pruned = repository.withModules(modules);
            context = FilterContext.of(pruned);
        }

        for (ScopedFilter step : filter.steps()) {
            if (step instanceof RepositoryFilter repositoryStep && !repositoryStep.retain().test(pruned, context)) {
                exclude(mark, FilterScope.REPOSITORY, repository, "");
                return Optional.empty();
            }
        }
        return Optional.of(pruned);
    }

    private Optional<SourceModule> pruneModule(SourceModule module, FilterContext parent) {
        int mark = exclusions.size();
        SourceModule pruned = module;

        if (filter.reaches(FilterScope.CLASS)) {
            FilterContext inside = parent.within(module);
            List<FunctionDefinition> functions = new ArrayList<>(module.functions().size());
            for (FunctionDefinition function : module.functions()) {
                if (retainsCallable(function, inside)) {
                    functions.add(function);
                } else {
                    exclude(exclusions.size(), FilterScope.FUNCTION, parent.repository(),
                        module.filePath() + "::" + function.identifier());
                }
            }
            List<ClassDefinition> classes = new ArrayList<>(module.classes().size());
            for (ClassDefinition type : module.classes()) {
                pruneClass(type, inside).ifPresent(classes::add);
            }
            pruned = module.withChildren(functions, classes);
        }

        FilterContext context = parent.within(pruned);
        for (ScopedFilter step : filter.steps()) {
            if (step instanceof ModuleFilter moduleStep && !moduleStep.retain().test(pruned, context)) {
                exclude(mark, FilterScope.MODULE, parent.repository(), module.filePath());
                return Optional.empty();
            }
        }
        return Optional.of(pruned);
    }

    private Optional<ClassDefinition> pruneClass(ClassDefinition type, FilterContext parent) {
        int mark = exclusions.size();
        String classPath = parent.module().filePath() + "::" + type.identifier();
        ClassDefinition pruned = type;

        if (filter.reaches(FilterScope.FUNCTION)) {
            FilterContext inside = parent.within(type);
            List<MethodDefinition> methods = new ArrayList<>(type.methods().size());
            for (MethodDefinition method : type.methods()) {
                if (retainsCallable(method, inside)) {
                    methods.add(method);
                } else {
                    exclude(exclusions.size(), FilterScope.FUNCTION, parent.repository(),
                        classPath + "." + method.identifier());
                }
            }
            pruned = type.withMethods(methods);
        }

        FilterContext context = parent.within(pruned);
        for (ScopedFilter step : filter.steps()) {
            if (step instanceof ClassFilter classStep && !classStep.retain().test(pruned, context)) {
                exclude(mark, FilterScope.CLASS, parent.repository(), classPath);
                return Optional.empty();
            }
        }
        return Optional.of(pruned);
    }

    private boolean retainsCallable(CallableDefinition callable, FilterContext context) {
        for (ScopedFilter step : filter.steps()) {
            if (step instanceof FunctionFilter functionStep && !functionStep.retain().test(callable, context)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Records an exclusion and drops the descendant exclusions recorded since {@code mark}.
     */
    private void exclude(int mark, FilterScope scope, Repository repository, String path) {
        exclusions.subList(mark, exclusions.size()).clear();
        exclusions.add(new FilterExclusion(filter.name(), scope, repository.name(), path));
    }
}
