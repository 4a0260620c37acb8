package com.structds.core.filter;

import com.structds.core.model.CallableDefinition;
import com.structds.core.model.ClassDefinition;
import com.structds.core.model.Repository;
import com.structds.core.model.SourceModule;

import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * One retention predicate bound to a single tree level.
 *
 * <p>The variant decides which level of the entity tree the {@link TreePruner} evaluates the
 * predicate at. A predicate returns {@code true} to keep the entity; rejecting an entity drops
 * everything it owns.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * ScopedFilter typedOnly = new ScopedFilter.FunctionFilter(
 *     (callable, context) -> callable.hasTypeInformation());
 * }</pre>
 */
public sealed interface ScopedFilter {

    /**
     * Gets the tree level this step applies to.
     *
     * @return filter scope
     */
    FilterScope scope();

    /**
     * Keeps or drops whole repositories.
     *
     * @param retain predicate over the repository with its modules already pruned
     */
    record RepositoryFilter(BiPredicate<Repository, FilterContext> retain) implements ScopedFilter {
        public RepositoryFilter {
            Objects.requireNonNull(retain, "retain must not be null");
        }

        @Override
        public FilterScope scope() {
            return FilterScope.REPOSITORY;
        }
    }

    /**
     * Keeps or drops modules.
     *
     * @param retain predicate over the module with its functions and classes already pruned
     */
    record ModuleFilter(BiPredicate<SourceModule, FilterContext> retain) implements ScopedFilter {
        public ModuleFilter {
            Objects.requireNonNull(retain, "retain must not be null");
        }

        @Override
        public FilterScope scope() {
            return FilterScope.MODULE;
        }
    }

    /**
     * Keeps or drops classes.
     *
     * @param retain predicate over the class with its methods already pruned
     */
    record ClassFilter(BiPredicate<ClassDefinition, FilterContext> retain) implements ScopedFilter {
        public ClassFilter {
            Objects.requireNonNull(retain, "retain must not be null");
        }

        @Override
        public FilterScope scope() {
            return FilterScope.CLASS;
        }
    }

    /**
     * Keeps or drops module functions and class methods.
     *
     * @param retain predicate over the callable
     */
    record FunctionFilter(BiPredicate<CallableDefinition, FilterContext> retain) implements ScopedFilter {
        public FunctionFilter {
            Objects.requireNonNull(retain, "retain must not be null");
        }

        @Override
        public FilterScope scope() {
            return FilterScope.FUNCTION;
        }
    }
}
