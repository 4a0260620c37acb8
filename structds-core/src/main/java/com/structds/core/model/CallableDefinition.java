package com.structds.core.model;

import com.structds.core.signature.TypeExpressions;

import java.util.List;

/**
 * Common shape of functions and methods.
 *
 * <p>{@link #signature()} and {@link #fullSignature()} are derived from the other fields on
 * every call; implementations never store them.
 *
 * @see FunctionDefinition
 * @see MethodDefinition
 */
public sealed interface CallableDefinition permits FunctionDefinition, MethodDefinition {

    String identifier();

    /**
     * Parameters in declaration order.
     */
    List<Parameter> parameters();

    /**
     * Decorators attached to the declaration, verbatim and newline-separated. Empty if none.
     */
    String annotations();

    /**
     * Declared return type, or {@code null}.
     */
    String returnType();

    /**
     * Source text of the body without the declaration header.
     */
    String body();

    int lineNumber();

    int colOffset();

    /**
     * Whether the callable was declared with {@code async def}.
     */
    boolean async();

    /**
     * Normalized {@code name(params) -> return} string without decorators.
     */
    String signature();

    /**
     * Decorators, then {@code async } for coroutines, then {@link #signature()}.
     */
    String fullSignature();

    /**
     * Returns true if at least one parameter or the return value has a declared type.
     *
     * @return true if any type information is present
     */
    default boolean hasTypeInformation() {
        return returnType() != null || parameters().stream().anyMatch(Parameter::hasDeclaredType);
    }

    /**
     * Returns true if a parameter or the return value is declared as exactly {@code str}.
     *
     * @return true if a {@code str} annotation is present
     */
    default boolean hasStrType() {
        return "str".equals(TypeExpressions.normalize(returnType()))
            || parameters().stream().anyMatch(p -> "str".equals(TypeExpressions.normalize(p.type())));
    }
}
