package com.structds.core.filter;

import com.structds.core.model.ClassDefinition;
import com.structds.core.model.Repository;
import com.structds.core.model.SourceModule;

import java.util.Objects;

/**
 * Position in the tree of the entity a filter step is looking at.
 *
 * <p>Each slot holds the enclosing node of that scope, or the entity itself when the step runs at
 * that scope: a module step sees its module in {@code module}, a class step sees its class in
 * {@code owningClass}. Entities seen at their own scope are already pruned. {@code module} is
 * {@code null} at repository scope; {@code owningClass} is {@code null} at repository and module
 * scope and for module functions.
 *
 * @param repository enclosing repository, or the repository under evaluation
 * @param module enclosing module, or the module under evaluation, or {@code null}
 * @param owningClass class owning a method, or the class under evaluation, or {@code null}
 */
public record FilterContext(Repository repository, SourceModule module, ClassDefinition owningClass) {

    public FilterContext {
        Objects.requireNonNull(repository, "repository must not be null");
    }

    static FilterContext of(Repository repository) {
        return new FilterContext(repository, null, null);
    }

    FilterContext within(SourceModule enclosingModule) {
        return new FilterContext(repository, enclosingModule, null);
    }

    FilterContext within(ClassDefinition enclosingClass) {
        return new FilterContext(repository, module, enclosingClass);
    }

    /**
     * Returns true if the entity under evaluation is a method or a class.
     *
     * @return true at class scope or inside a class
     */
    public boolean insideClass() {
        return owningClass != null;
    }
}
