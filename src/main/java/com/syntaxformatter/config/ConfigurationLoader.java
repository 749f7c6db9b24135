package com.syntaxformatter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.syntaxformatter.syntax.ViewMode;
import com.syntaxformatter.util.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads formatter configuration from YAML, validating values and falling
 * back to defaults for anything missing or out of range.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    private static volatile FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file with fallback to defaults.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.warning("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.warning("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try (InputStream stream = Files.newInputStream(configPath)) {
            logger.info("Loading configuration from: " + configPath);
            FormatterConfig formatterConfig = loadConfig(stream);
            logger.fine("Configuration loaded with " + formatterConfig.getGeneralConfigMap().size() + " general values");
            return formatterConfig;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Parses configuration from a stream. Invalid values are replaced with
     * defaults; only unreadable YAML fails.
     */
    public static FormatterConfig loadConfig(InputStream stream) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        Object parsed = mapper.readValue(stream, Object.class);
        if (!(parsed instanceof Map)) {
            logger.warning("Configuration is not a YAML mapping, using defaults");
            return _createEmptyConfig();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) parsed;
        return _createConfigFromMap(config);
    }

    /**
     * Loads the embedded default configuration with caching.
     */
    public static FormatterConfig loadDefaultConfig() {
        FormatterConfig cached = _cachedDefaultConfig;
        if (cached != null) {
            return cached;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            _cachedDefaultConfig = loadConfig(defaultConfigStream);
            logger.fine("Default configuration loaded successfully");
            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    @SuppressWarnings("unchecked")
    private static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else {
            logger.warning("Missing or invalid 'general' section in config, using defaults");
        }

        _validateIntRange(generalConfig, FormatterConfig.INDENT_SIZE, 1, 16);
        _validateIntRange(generalConfig, FormatterConfig.INITIAL_INDENT_SIZE, 0, 64);
        _validateViewMode(generalConfig);
        _ensureDefaultGeneralConfig(generalConfig);

        return new FormatterConfig(generalConfig);
    }

    /**
     * Drops an integer value outside {@code [min, max]} so the default
     * takes its place.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config.get(key) instanceof Number) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value.");
                config.remove(key);
            }
        }
    }

    private static void _validateViewMode(Map<String, Object> config) {
        Object value = config.get(FormatterConfig.VIEW_MODE);
        if (value == null) {
            return;
        }
        try {
            ViewMode.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warning("Unknown view mode '" + value + "'. Using default value.");
            config.remove(FormatterConfig.VIEW_MODE);
        }
    }

    private static FormatterConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);
        return new FormatterConfig(generalConfig);
    }

    /**
     * Ensures that general configuration has all required default values.
     */
    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        if (!(generalConfig.get(FormatterConfig.INDENT_SIZE) instanceof Number)) {
            generalConfig.put(FormatterConfig.INDENT_SIZE, 4);
        }
        if (!(generalConfig.get(FormatterConfig.USE_TABS) instanceof Boolean)) {
            generalConfig.put(FormatterConfig.USE_TABS, false);
        }
        if (!(generalConfig.get(FormatterConfig.INITIAL_INDENT_SIZE) instanceof Number)) {
            generalConfig.put(FormatterConfig.INITIAL_INDENT_SIZE, 0);
        }
        if (!(generalConfig.get(FormatterConfig.VIEW_MODE) instanceof String)) {
            generalConfig.put(FormatterConfig.VIEW_MODE, ViewMode.SOURCE_ACCURATE.name());
        }
        if (generalConfig.containsKey(FormatterConfig.METADATA_FILE)
                && !(generalConfig.get(FormatterConfig.METADATA_FILE) instanceof String)) {
            logger.warning("Configuration value 'metadataFile' is not a path, ignoring it");
            generalConfig.remove(FormatterConfig.METADATA_FILE);
        }
    }

    /**
     * Saves configuration to a file, creating parent directories as needed.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new HashMap<>();
            configMap.put("general", config.getGeneralConfigMap());

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
