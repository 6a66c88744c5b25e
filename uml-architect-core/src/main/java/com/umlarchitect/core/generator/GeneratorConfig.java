package com.umlarchitect.core.generator;

import java.util.Map;

/**
 * Configuration for diagram generation.
 *
 * @param indent indentation unit repeated once per nesting level
 * @param wrapDocument whether to wrap the diagram in document start/end markers
 * @param customSettings generator-specific custom settings
 */
public record GeneratorConfig(
    String indent,
    boolean wrapDocument,
    Map<String, Object> customSettings
) {
    /** Four spaces. */
    public static final String DEFAULT_INDENT = "    ";

    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (indent == null || indent.isEmpty()) {
            indent = DEFAULT_INDENT;
        }
        if (customSettings == null) {
            customSettings = Map.of();
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return four-space indent, wrapped document, no custom settings
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(DEFAULT_INDENT, true, Map.of());
    }

    /**
     * Returns a copy with a different indentation unit.
     *
     * @param indent indentation unit
     * @return new config
     */
    public GeneratorConfig withIndent(String indent) {
        return new GeneratorConfig(indent, wrapDocument, customSettings);
    }

    /**
     * Gets a custom setting value.
     *
     * @param key setting key
     * @param <T> expected type
     * @return setting value or null
     */
    @SuppressWarnings("unchecked")
    public <T> T getSetting(String key) {
        return (T) customSettings.get(key);
    }

    /**
     * Gets a custom setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @param <T> expected type
     * @return setting value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }
}
