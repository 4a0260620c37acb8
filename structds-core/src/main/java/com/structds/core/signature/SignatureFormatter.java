package com.structds.core.signature;

import com.structds.core.model.Parameter;
import com.structds.core.model.ParameterKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders signatures and full signatures of functions and methods.
 *
 * <p>Both strings are pure functions of the declaration fields:
 * <pre>{@code
 * signature     = name(a, b: int, /, *args: str, key: bool, **rest) -> Result
 * fullSignature = @decorator\n + [async ] + signature
 * }</pre>
 *
 * <p>Type expressions are passed through {@link TypeExpressions#normalize(String)}; decorators are
 * copied as written.
 */
public final class SignatureFormatter {

    private static final String SEPARATOR = ", ";
    private static final String RETURN_ARROW = " -> ";
    private static final String POSITIONAL_ONLY_MARKER = "/";
    private static final String KEYWORD_ONLY_MARKER = "*";
    private static final String ASYNC_PREFIX = "async ";

    private SignatureFormatter() {
        // Utility class - no instantiation
    }

    /**
     * Builds the normalized signature.
     *
     * @param identifier declared name
     * @param parameters parameters in declaration order
     * @param returnType declared return type or {@code null}
     * @return signature string
     */
    public static String signature(String identifier, List<Parameter> parameters, String returnType) {
        StringBuilder signature = new StringBuilder(identifier).append('(');
        signature.append(String.join(SEPARATOR, renderParameters(parameters)));
        signature.append(')');
        if (returnType != null) {
            signature.append(RETURN_ARROW).append(TypeExpressions.normalize(returnType));
        }
        return signature.toString();
    }

    /**
     * Prefixes a signature with the raw decorator text.
     *
     * @param annotations decorator text, empty or {@code null} if none
     * @param signature signature built by {@link #signature(String, List, String)}
     * @return full signature; ends with {@code signature}
     */
    public static String fullSignature(String annotations, String signature) {
        if (annotations == null || annotations.isBlank()) {
            return signature;
        }
        return annotations + "\n" + signature;
    }

    /**
     * Prefixes a signature with the raw decorator text and, for coroutines, the {@code async}
     * keyword.
     *
     * @param annotations decorator text, empty or {@code null} if none
     * @param async whether the callable is declared with {@code async def}
     * @param signature signature built by {@link #signature(String, List, String)}
     * @return full signature; ends with {@code signature}
     */
    public static String fullSignature(String annotations, boolean async, String signature) {
        return fullSignature(annotations, async ? ASYNC_PREFIX + signature : signature);
    }

    private static List<String> renderParameters(List<Parameter> parameters) {
        boolean hasVarPositional = parameters.stream()
            .anyMatch(p -> p.kind() == ParameterKind.VAR_POSITIONAL);
        boolean keywordMarkerNeeded = !hasVarPositional;

        List<String> parts = new ArrayList<>();
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            if (parameter.kind() == ParameterKind.KEYWORD_ONLY && keywordMarkerNeeded) {
                parts.add(KEYWORD_ONLY_MARKER);
                keywordMarkerNeeded = false;
            }
            parts.add(renderParameter(parameter));
            if (parameter.kind() == ParameterKind.POSITIONAL_ONLY && !nextIsPositionalOnly(parameters, i)) {
                parts.add(POSITIONAL_ONLY_MARKER);
            }
        }
        return parts;
    }

    private static boolean nextIsPositionalOnly(List<Parameter> parameters, int index) {
        return index + 1 < parameters.size()
            && parameters.get(index + 1).kind() == ParameterKind.POSITIONAL_ONLY;
    }

    private static String renderParameter(Parameter parameter) {
        String prefix = switch (parameter.kind()) {
            case VAR_POSITIONAL -> "*";
            case VAR_KEYWORD -> "**";
            default -> "";
        };
        if (parameter.type() == null) {
            return prefix + parameter.identifier();
        }
        return prefix + parameter.identifier() + ": " + TypeExpressions.normalize(parameter.type());
    }
}
