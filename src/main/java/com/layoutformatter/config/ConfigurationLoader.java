package com.layoutformatter.config;

import com.layoutformatter.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads formatter options from YAML, filling in defaults and dropping out-of-range values.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    private static final Map<String, Object> DEFAULT_GENERAL = Map.of(
            "printWidth", 80,
            "indentSize", 2);

    private static final Map<String, Map<String, Object>> DEFAULT_PASSES = Map.of(
            FormatterConfig.ALIGNMENT, Map.of(
                    "comments", true,
                    "assignments", true,
                    "callArguments", true,
                    "caseWhen", false),
            FormatterConfig.CALL_SHAPE, Map.of("enabled", true),
            FormatterConfig.COMPACTION, Map.of("enabled", true));

    private static FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file, falling back to the bundled defaults when the file
     * is missing or unreadable.
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

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);

            return _createConfigFromMap(config == null ? new HashMap<>() : config);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the bundled default configuration once and caches it.
     */
    public static synchronized FormatterConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createConfigFromMap(new HashMap<>());
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createConfigFromMap(new HashMap<>());
        }
    }

    @SuppressWarnings("unchecked")
    private static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig.putAll((Map<String, Object>) config.get("general"));
        } else if (config.containsKey("general")) {
            logger.warning("Invalid 'general' section in config, using defaults");
        }

        Map<String, Map<String, Object>> passConfigs = new HashMap<>();
        if (config.get("passes") instanceof Map) {
            Map<String, Object> passesMap = (Map<String, Object>) config.get("passes");

            for (Map.Entry<String, Object> entry : passesMap.entrySet()) {
                if (!DEFAULT_PASSES.containsKey(entry.getKey())) {
                    logger.warning("Ignoring configuration for unknown pass '" + entry.getKey() + "'");
                } else if (entry.getValue() instanceof Map) {
                    passConfigs.put(entry.getKey(), new HashMap<>((Map<String, Object>) entry.getValue()));
                } else {
                    logger.warning("Invalid configuration for pass '" + entry.getKey() + "', using defaults");
                }
            }
        } else if (config.containsKey("passes")) {
            logger.warning("Invalid 'passes' section in config, using defaults");
        }

        _validateIntRange(generalConfig, "printWidth", 20, 400);
        _validateIntRange(generalConfig, "indentSize", 1, 8);

        _ensureDefaults(generalConfig, DEFAULT_GENERAL, "general");
        for (Map.Entry<String, Map<String, Object>> entry : DEFAULT_PASSES.entrySet()) {
            Map<String, Object> passConfig = passConfigs.computeIfAbsent(entry.getKey(), k -> new HashMap<>());
            _ensureDefaults(passConfig, entry.getValue(), entry.getKey());
        }

        return new FormatterConfig(generalConfig, passConfigs);
    }

    /**
     * Removes an integer value that is outside the accepted range so the default applies.
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

    /**
     * Replaces missing values, and values whose type differs from the default's, by the default.
     */
    private static void _ensureDefaults(Map<String, Object> config, Map<String, Object> defaults, String section) {
        for (Map.Entry<String, Object> entry : defaults.entrySet()) {
            Object value = config.get(entry.getKey());
            Object defaultValue = entry.getValue();
            boolean sameType = value != null && (defaultValue instanceof Number
                    ? value instanceof Number
                    : defaultValue.getClass().isInstance(value));
            if (!sameType) {
                if (value != null) {
                    logger.warning("Invalid value for '" + section + "." + entry.getKey() + "': " + value
                            + ", using " + defaultValue);
                }
                config.put(entry.getKey(), defaultValue);
            }
        }
    }
}
