package com.dogfold.scaffold.codegen.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Loads {@link ScaffoldConfig} from a YAML file.
 *
 * <p>A missing file is the normal case and yields {@link ScaffoldConfig#defaults()}. A file that
 * cannot be read or parsed is logged as an error and also yields the defaults.
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "dogfold.yml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file, or returns defaults if it is missing or invalid.
     *
     * @param configPath path to {@code dogfold.yml}
     * @return loaded configuration or defaults
     */
    public static ScaffoldConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("No configuration file at {}, using defaults", configPath);
            return ScaffoldConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ScaffoldConfig.defaults();
        }

        try {
            ScaffoldConfig config = YAML_MAPPER.readValue(configPath.toFile(), ScaffoldConfig.class);
            if (config == null) {
                log.debug("Configuration file {} is empty, using defaults", configPath);
                return ScaffoldConfig.defaults();
            }
            log.debug("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                    configPath, e.getMessage());
            return ScaffoldConfig.defaults();
        }
    }

    /**
     * Loads {@code dogfold.yml} from the repository root.
     */
    public static ScaffoldConfig loadFromRepository(Path repoRoot) {
        return load(repoRoot.resolve(DEFAULT_FILE_NAME));
    }
}
