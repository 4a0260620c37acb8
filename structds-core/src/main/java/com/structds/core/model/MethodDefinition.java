package com.structds.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.structds.core.signature.SignatureFormatter;

import java.util.List;
import java.util.Objects;

/**
 * A function declared directly in a class body.
 *
 * @param identifier method name
 * @param parameters parameters in declaration order, including {@code self}/{@code cls}
 * @param annotations raw decorator text, empty if none
 * @param returnType declared return type or {@code null}
 * @param body body source text
 * @param constructor whether this is the class initializer
 * @param lineNumber 1-based line of the {@code def} keyword
 * @param colOffset 1-based column of the method name
 * @param async whether declared with {@code async def}
 */
@JsonIgnoreProperties(value = {"signature", "full_signature"}, allowGetters = true, ignoreUnknown = true)
public record MethodDefinition(
    @JsonProperty("identifier") String identifier,
    @JsonProperty("parameters") List<Parameter> parameters,
    @JsonProperty("annotations") String annotations,
    @JsonProperty("return") String returnType,
    @JsonProperty("body") String body,
    @JsonProperty("constructor") boolean constructor,
    @JsonProperty("line_number") int lineNumber,
    @JsonProperty("col_offset") int colOffset,
    @JsonProperty("async") boolean async
) implements CallableDefinition {

    public MethodDefinition {
        Objects.requireNonNull(identifier, "identifier must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        annotations = annotations != null ? annotations : "";
        body = body != null ? body : "";
    }

    /**
     * Creates a plain, non-async method.
     */
    public MethodDefinition(String identifier, List<Parameter> parameters, String annotations, String returnType,
                            String body, boolean constructor, int lineNumber, int colOffset) {
        this(identifier, parameters, annotations, returnType, body, constructor, lineNumber, colOffset, false);
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
