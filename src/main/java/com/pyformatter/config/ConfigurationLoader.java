package com.pyformatter.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.pyformatter.model.BlockKind;
import com.pyformatter.util.LoggerUtil;

/**
 * Loads {@link FormatterConfig} from YAML, falling back to the bundled defaults when the
 * file is missing or unreadable and repairing invalid values with a warning.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";
    private static final int MAX_THREADS = 256;

    private static FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file with fallback to defaults.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.fine("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.fine("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);
            if (config == null) {
                config = new HashMap<>();
            }

            return _createConfigFromMap(config);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration with caching.
     */
    public static synchronized FormatterConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded");

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
        } else if (config.containsKey("general")) {
            logger.warning("Invalid 'general' section in config, using defaults");
        }

        Map<String, Object> rulesConfig = new HashMap<>();
        if (config.get("rules") instanceof Map) {
            rulesConfig = new HashMap<>((Map<String, Object>) config.get("rules"));
        } else if (config.containsKey("rules")) {
            logger.warning("Invalid 'rules' section in config, using defaults");
        }

        _validateConfigurationValues(generalConfig, rulesConfig);
        _ensureDefaultGeneralConfig(generalConfig);
        _ensureDefaultRulesConfig(rulesConfig);

        return new FormatterConfig(generalConfig, rulesConfig);
    }

    /**
     * Drops values of the wrong shape or out of range so the defaults take their place.
     */
    private static void _validateConfigurationValues(Map<String, Object> generalConfig, Map<String, Object> rulesConfig) {
        _validateIntRange(generalConfig, "threads", 0, MAX_THREADS);
        _validateList(generalConfig, "ignoreFiles");
        _validateList(rulesConfig, "enabled");
        _validateList(rulesConfig, "disabled");
        _validateList(rulesConfig, "markedBlocks");
    }

    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (!config.containsKey(key)) {
            return;
        }
        Object value = config.get(key);
        if (!(value instanceof Number)) {
            logger.warning("Configuration value '" + key + "' is not a number. Using default value.");
            config.remove(key);
            return;
        }
        int number = ((Number) value).intValue();
        if (number < min || number > max) {
            logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                    "(" + min + "-" + max + "). Using default value.");
            config.remove(key);
        }
    }

    private static void _validateList(Map<String, Object> config, String key) {
        if (config.containsKey(key) && config.get(key) != null && !(config.get(key) instanceof List)) {
            logger.warning("Configuration value '" + key + "' must be a list. Using default value.");
            config.remove(key);
        }
    }

    private static FormatterConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Object> rulesConfig = new HashMap<>();
        _ensureDefaultRulesConfig(rulesConfig);

        return new FormatterConfig(generalConfig, rulesConfig);
    }

    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        if (!(generalConfig.get("threads") instanceof Number)) {
            generalConfig.put("threads", 0);
        }
        if (!(generalConfig.get("ignoreFiles") instanceof List)) {
            generalConfig.put("ignoreFiles", new ArrayList<String>());
        }
    }

    private static void _ensureDefaultRulesConfig(Map<String, Object> rulesConfig) {
        if (!(rulesConfig.get("enabled") instanceof List)) {
            rulesConfig.put("enabled", new ArrayList<String>());
        }
        if (!(rulesConfig.get("disabled") instanceof List)) {
            rulesConfig.put("disabled", new ArrayList<String>());
        }
        if (!(rulesConfig.get("markedBlocks") instanceof List)) {
            List<String> kinds = new ArrayList<>();
            for (BlockKind kind : RuleConfig.DEFAULT_MARKED_BLOCKS) {
                kinds.add(kind.configKey());
            }
            rulesConfig.put("markedBlocks", kinds);
        }
    }

    /**
     * Writes the configuration as YAML, creating parent directories as needed.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", config.getGeneralConfigMap());
            configMap.put("rules", config.getRulesConfigMap());

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
