package com.structds.core.serializer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.structds.core.model.Dataset;
import com.structds.core.model.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads dataset files written by {@link DatasetWriter}.
 *
 * <p>A file may hold an array of repositories or a single repository object. Stored
 * {@code signature} and {@code full_signature} values are ignored; they are recomputed from
 * the other fields whenever they are read from the model.
 */
public class DatasetReader {

    private static final Logger log = LoggerFactory.getLogger(DatasetReader.class);

    private static final TypeReference<List<Repository>> REPOSITORY_LIST = new TypeReference<>() {
    };

    /**
     * Reads a dataset file.
     *
     * @param source dataset file
     * @return dataset
     * @throws IOException if the file cannot be read or is not a dataset
     */
    public Dataset read(Path source) throws IOException {
        ObjectMapper mapper = DatasetJson.mapper();
        JsonNode root = mapper.readTree(source.toFile());
        List<Repository> repositories;
        if (root == null || root.isMissingNode() || root.isNull()) {
            repositories = List.of();
        } else if (root.isArray()) {
            repositories = mapper.readerFor(REPOSITORY_LIST).readValue(root);
        } else if (root.isObject()) {
            repositories = List.of(mapper.treeToValue(root, Repository.class));
        } else {
            throw new IOException("Not a dataset file: " + source);
        }
        log.debug("Read {} repositories from {}", repositories.size(), source);
        return new Dataset(repositories);
    }
}
