package com.dwimerge.core.config;

import com.dwimerge.core.error.ConfigException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading merge configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code dwimerge.yaml} into {@link MergeConfig} records.
 * A missing, unreadable or malformed file is a {@link ConfigException}: a merge never runs
 * on settings the user did not write.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MergeConfig config = ConfigLoader.load(Path.of("dwimerge.yaml"));
 * MergeSettings settings = MergeConfigValidator.validate(config, Path.of("."));
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Default configuration file name. */
    public static final String DEFAULT_FILE_NAME = "dwimerge.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code dwimerge.yaml}
     * @return loaded configuration
     * @throws ConfigException if the file is missing, unreadable or not valid YAML for {@link MergeConfig}
     */
    public static MergeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigException(configPath.toString(), "Configuration file not found");
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new ConfigException(configPath.toString(), "Configuration file is not readable");
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            MergeConfig config = YAML_MAPPER.readValue(configPath.toFile(), MergeConfig.class);
            if (config == null) {
                throw new ConfigException(configPath.toString(), "Configuration file is empty");
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            throw new ConfigException(configPath.toString(), "Failed to parse configuration: " + e.getMessage(), e);
        }
    }
}
