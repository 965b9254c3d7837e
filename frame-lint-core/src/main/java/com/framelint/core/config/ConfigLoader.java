package com.framelint.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading Frame Lint configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code framelint.yaml} into {@link LintConfig} records.
 * If the config file is missing or invalid, returns {@link LintConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LintConfig config = ConfigLoader.load(Paths.get("framelint.yaml"));
 *
 * if (config.rules().isEnabled("WRAP_OFF")) {
 *     // rule is active
 * }
 * }</pre>
 */
public final class ConfigLoader {

    /** Configuration file looked up in the working directory when none is given. */
    public static final String DEFAULT_FILE_NAME = "framelint.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link LintConfig#defaults()} with all rules enabled.
     *
     * @param configPath path to {@code framelint.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static LintConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults (all rules enabled).", configPath);
            return LintConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return LintConfig.defaults();
        }

        try {
            return parse(configPath);
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return LintConfig.defaults();
        }
    }

    /**
     * Parses a YAML file strictly, without falling back to defaults.
     *
     * <p>Used by validation, where a broken file must be reported rather than ignored.
     *
     * @param configPath path to {@code framelint.yaml}
     * @return parsed configuration
     * @throws IOException if the file cannot be read or is not valid configuration
     */
    public static LintConfig parse(Path configPath) throws IOException {
        log.debug("Loading configuration from: {}", configPath);
        String content = Files.readString(configPath);
        LintConfig config = content.isBlank() ? null : YAML_MAPPER.readValue(content, LintConfig.class);
        if (config == null) {
            // empty document
            config = LintConfig.defaults();
        }
        log.info("Loaded configuration from: {}", configPath);
        return config;
    }
}
