package com.structds.core.serializer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson configuration for dataset and report files.
 *
 * <p>Property names come from the {@code @JsonProperty} annotations of the model records.
 * Absent optional values are written as JSON {@code null}.
 */
public final class DatasetJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private DatasetJson() {
        // Utility class
    }

    /**
     * Gets the configured mapper. The instance is thread-safe and must not be reconfigured.
     *
     * @return shared object mapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
