package com.structds.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading run configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code structds.yaml} into {@link DatasetConfig} records.
 * A missing or empty file yields {@link DatasetConfig#defaults()}. A file that exists but cannot
 * be read, is not valid YAML, does not bind to the configuration records or holds out-of-range
 * values is a {@link ConfigurationException}, which aborts the run.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DatasetConfig config = ConfigLoader.load(Path.of("structds.yaml"));
 * int workers = config.extraction().workers();
 * }</pre>
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "structds.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or is empty, logs a warning and returns
     * {@link DatasetConfig#defaults()}.
     *
     * @param configPath path to {@code structds.yaml}
     * @return loaded configuration or defaults if absent
     * @throws ConfigurationException if the file is unreadable or malformed, or a value is out of range
     */
    public static DatasetConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return DatasetConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new ConfigurationException("Configuration file is not readable: " + configPath);
        }

        DatasetConfig config;
        try {
            log.debug("Loading configuration from: {}", configPath);
            config = YAML_MAPPER.readValue(configPath.toFile(), DatasetConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException(
                "Failed to parse configuration file " + configPath + ": " + e.getMessage(), e);
        }
        if (config == null) {
            log.warn("Configuration file is empty: {}. Using defaults.", configPath);
            return DatasetConfig.defaults();
        }
        config.validate();
        log.info("Loaded configuration from: {}", configPath);
        return config;
    }
}
