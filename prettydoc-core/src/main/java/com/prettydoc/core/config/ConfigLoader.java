package com.prettydoc.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads PrettyDoc configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code prettydoc.yaml} into {@link PrettyDocConfig}. Loading
 * never fails: a missing, unreadable or invalid file yields {@link PrettyDocConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PrettyDocConfig config = ConfigLoader.load(Path.of("prettydoc.yaml"));
 * String text = DocumentRenderer.render(doc, config.renderOptions());
 * }</pre>
 */
public class ConfigLoader {

    /** Conventional configuration file name */
    public static final String DEFAULT_FILE_NAME = "prettydoc.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code prettydoc.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static PrettyDocConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return PrettyDocConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return PrettyDocConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            PrettyDocConfig config = YAML_MAPPER.readValue(configPath.toFile(), PrettyDocConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return PrettyDocConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return PrettyDocConfig.defaults();
        }
    }
}
