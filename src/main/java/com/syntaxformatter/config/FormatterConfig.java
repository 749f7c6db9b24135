package com.syntaxformatter.config;

import com.syntaxformatter.syntax.ViewMode;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration for the formatter. Values come from the {@code general}
 * section of the YAML configuration.
 */
public class FormatterConfig {
    public static final String INDENT_SIZE = "indentSize";
    public static final String USE_TABS = "useTabs";
    public static final String INITIAL_INDENT_SIZE = "initialIndentSize";
    public static final String VIEW_MODE = "viewMode";
    public static final String METADATA_FILE = "metadataFile";

    private final Map<String, Object> generalConfig;

    public FormatterConfig(Map<String, Object> generalConfig) {
        this.generalConfig = new HashMap<>(generalConfig);
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Looks up a general value, converting between compatible types where
     * YAML parsing picked a different one than the caller expects.
     */
    @SuppressWarnings("unchecked")
    public <T> T getGeneralConfig(String key, T defaultValue) {
        Object value = generalConfig.get(key);
        if (value == null) {
            return defaultValue;
        }

        if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {
            if (defaultValue instanceof Integer && value instanceof Number) {
                return (T) Integer.valueOf(((Number) value).intValue());
            } else if (defaultValue instanceof Boolean && value instanceof String) {
                return (T) Boolean.valueOf(value.toString());
            } else if (defaultValue instanceof String) {
                return (T) value.toString();
            }
            return defaultValue;
        }

        return (T) value;
    }

    public int getIndentSize() {
        return getGeneralConfig(INDENT_SIZE, 4);
    }

    public boolean isUseTabs() {
        return getGeneralConfig(USE_TABS, false);
    }

    public int getInitialIndentSize() {
        return getGeneralConfig(INITIAL_INDENT_SIZE, 0);
    }

    public ViewMode getViewMode() {
        String name = getGeneralConfig(VIEW_MODE, ViewMode.SOURCE_ACCURATE.name());
        try {
            return ViewMode.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ViewMode.SOURCE_ACCURATE;
        }
    }

    /**
     * The metadata table to use instead of the bundled one, or null.
     */
    public Path getMetadataFile() {
        String file = getGeneralConfig(METADATA_FILE, (String) null);
        return file == null || file.isBlank() ? null : Paths.get(file);
    }
}
