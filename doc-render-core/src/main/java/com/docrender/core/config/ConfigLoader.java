package com.docrender.core.config;

import com.docrender.core.error.ConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading DocRender configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code docrender.yaml} into {@link RenderConfig} records.
 * {@link #load} falls back to {@link RenderConfig#defaults()} when the file is missing or invalid;
 * {@link #loadStrict} reports the problem instead.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RenderConfig config = ConfigLoader.load(Path.of("docrender.yaml"));
 * List<String> formats = config.formats();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "docrender.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link RenderConfig#defaults()}.
     *
     * @param configPath path to {@code docrender.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static RenderConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return RenderConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return RenderConfig.defaults();
        }

        try {
            return read(configPath);
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return RenderConfig.defaults();
        }
    }

    /**
     * Loads configuration from a YAML file, failing on any problem.
     *
     * @param configPath path to {@code docrender.yaml}
     * @return loaded configuration
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public static RenderConfig loadStrict(Path configPath) {
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new ConfigurationException("Configuration file not found or not readable: " + configPath);
        }
        RenderConfig config;
        try {
            config = read(configPath);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse configuration file " + configPath + ": " + e.getMessage());
        }
        if (!config.problems().isEmpty()) {
            throw new ConfigurationException("Invalid configuration " + configPath + ": " + String.join("; ", config.problems()));
        }
        return config;
    }

    private static RenderConfig read(Path configPath) throws IOException {
        log.debug("Loading configuration from: {}", configPath);
        RenderConfig config = YAML_MAPPER.readValue(configPath.toFile(), RenderConfig.class);
        if (config == null) {
            config = RenderConfig.defaults();
        }
        log.info("Loaded configuration from: {}", configPath);
        return config;
    }
}
