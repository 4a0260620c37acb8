package com.structds.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.structds.core.signature.SignatureFormatter;

import java.util.List;
import java.util.Objects;

/**
 * A function declared at the top level of a module.
 *
 * @param identifier function name
 * @param parameters parameters in declaration order
 * @param annotations raw decorator text, empty if none
 * @param returnType declared return type or {@code null}
 * @param body body source text
 * @param file path of the declaring module, relative to the repository root
 * @param lineNumber 1-based line of the {@code def} keyword
 * @param colOffset 1-based column of the function name
 * @param async whether declared with {@code async def}
 */
@JsonIgnoreProperties(value = {"signature", "full_signature"}, allowGetters = true, ignoreUnknown = true)
public record FunctionDefinition(
    @JsonProperty("identifier") String identifier,
    @JsonProperty("parameters") List<Parameter> parameters,
    @JsonProperty("annotations") String annotations,
    @JsonProperty("return") String returnType,
    @JsonProperty("body") String body,
    @JsonProperty("file") String file,
    @JsonProperty("line_number") int lineNumber,
    @JsonProperty("col_offset") int colOffset,
    @JsonProperty("async") boolean async
) implements CallableDefinition {

    public FunctionDefinition {
        Objects.requireNonNull(identifier, "identifier must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        annotations = annotations != null ? annotations : "";
        body = body != null ? body : "";
    }

    /**
     * Creates a plain, non-async function.
     */
    public FunctionDefinition(String identifier, List<Parameter> parameters, String annotations, String returnType,
                              String body, String file, int lineNumber, int colOffset) {
        this(identifier, parameters, annotations, returnType, body, file, lineNumber, colOffset, false);
    }

    @Override
    @JsonProperty("signature")
    public String signature() {
        return SignatureFormatter.signature(identifier, parameters, returnType);
    }

    @Override
    @JsonProperty("full_signature")
    public String fullSignature() {
        return SignatureFormatter.fullSignature(annotations, async, signature());
    }
}
