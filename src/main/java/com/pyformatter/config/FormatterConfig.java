package com.pyformatter.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration as read from {@code .pyformatter.yml}: a {@code general} section for the
 * file walker and a {@code rules} section for the formatting core.
 */
public class FormatterConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Object> rulesConfig;

    public FormatterConfig(Map<String, Object> generalConfig, Map<String, Object> rulesConfig) {
        this.generalConfig = generalConfig;
        this.rulesConfig = rulesConfig;
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a copy of the rules config map.
     */
    public Map<String, Object> getRulesConfigMap() {
        return new HashMap<>(rulesConfig);
    }

    public <T> T getGeneralConfig(String key, T defaultValue) {
        return _convert(generalConfig.get(key), defaultValue);
    }

    public <T> T getRulesConfig(String key, T defaultValue) {
        return _convert(rulesConfig.get(key), defaultValue);
    }

    @SuppressWarnings("unchecked")
    private static <T> T _convert(Object value, T defaultValue) {
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
            } else if (defaultValue instanceof List && value instanceof Collection) {
                return (T) new ArrayList<>((Collection<?>) value);
            }
            return defaultValue;
        }
        return (T) value;
    }

    /**
     * Resolves the {@code rules} section, with command-line overrides, into the set of
     * rules the core runs. Extra enabled ids replace the configured enabled list when
     * given; extra disabled ids are added to the configured ones.
     */
    public RuleConfig toRuleConfig(List<String> extraEnabled, List<String> extraDisabled) {
        List<String> enabled = _stringList(rulesConfig.get("enabled"));
        if (extraEnabled != null && !extraEnabled.isEmpty()) {
            enabled = new ArrayList<>(extraEnabled);
        }
        List<String> disabled = _stringList(rulesConfig.get("disabled"));
        if (extraDisabled != null) {
            disabled.addAll(extraDisabled);
        }
        Object markedBlocks = rulesConfig.get("markedBlocks");
        return RuleConfig.resolve(enabled, disabled, markedBlocks instanceof Collection ? _stringList(markedBlocks) : null);
    }

    public RuleConfig toRuleConfig() {
        return toRuleConfig(null, null);
    }

    private static List<String> _stringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }
}
