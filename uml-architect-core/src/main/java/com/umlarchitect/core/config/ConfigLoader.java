package com.umlarchitect.core.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Utility for loading UML Architect configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code umlarchitect.yaml} into {@link ProjectConfig} records.
 * If the config file is missing or invalid, returns {@link ProjectConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectConfig config = ConfigLoader.load(Paths.get("umlarchitect.yaml"));
 * GeneratorConfig generatorConfig = config.effectiveGenerator().toGeneratorConfig();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link ProjectConfig#defaults()}.
     *
     * @param configPath path to {@code umlarchitect.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ProjectConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ProjectConfig config = YAML_MAPPER.readValue(configPath.toFile(), ProjectConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ProjectConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ProjectConfig.defaults();
        }
    }
}
