package com.framelint.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Destination and settings handed to a renderer.
 *
 * @param outputDirectory target directory (ignored by the console renderer)
 * @param settings renderer-specific settings, keys prefixed with the renderer id
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Reads a boolean setting.
     *
     * @param key setting key
     * @param defaultValue value when the key is absent
     * @return parsed value
     */
    public boolean isEnabled(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }
}
