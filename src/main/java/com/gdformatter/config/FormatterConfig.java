package com.gdformatter.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of the {@code general} and {@code plugins} sections of a configuration file.
 */
public class FormatterConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> pluginConfigs;

    public FormatterConfig(Map<String, Object> generalConfig,
                           Map<String, Map<String, Object>> pluginConfigs) {
        this.generalConfig = new HashMap<>(generalConfig);
        this.pluginConfigs = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : pluginConfigs.entrySet()) {
            this.pluginConfigs.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a copy of the plugin configs map.
     */
    public Map<String, Map<String, Object>> getPluginConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : pluginConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    public <T> T getGeneralConfig(String key, T defaultValue) {
        return _coerce(generalConfig.get(key), defaultValue);
    }

    public <T> T getPluginConfig(String plugin, String key, T defaultValue) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        if (pluginConfig == null) {
            return defaultValue;
        }
        return _coerce(pluginConfig.get(key), defaultValue);
    }

    /**
     * Glob patterns, relative to the formatted directory, of files to leave alone.
     */
    public List<String> getIgnorePatterns() {
        Object value = generalConfig.get("ignoreFiles");
        List<String> patterns = new ArrayList<>();
        if (value instanceof List) {
            for (Object pattern : (List<?>) value) {
                if (pattern != null) {
                    patterns.add(pattern.toString());
                }
            }
        }
        return patterns;
    }

    /**
     * Copy with one general setting replaced, used for command line overrides.
     */
    public FormatterConfig withGeneral(String key, Object value) {
        Map<String, Object> general = getGeneralConfigMap();
        general.put(key, value);
        return new FormatterConfig(general, pluginConfigs);
    }

    /**
     * Copy with one plugin setting replaced.
     */
    public FormatterConfig withPluginConfig(String plugin, String key, Object value) {
        Map<String, Map<String, Object>> plugins = getPluginConfigsMap();
        plugins.computeIfAbsent(plugin, k -> new HashMap<>()).put(key, value);
        return new FormatterConfig(generalConfig, plugins);
    }

    @SuppressWarnings("unchecked")
    private static <T> T _coerce(Object value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue == null || defaultValue.getClass().isInstance(value)) {
            return (T) value;
        }

        if (defaultValue instanceof Integer && value instanceof Number) {
            return (T) Integer.valueOf(((Number) value).intValue());
        } else if (defaultValue instanceof Integer && value instanceof String) {
            try {
                return (T) Integer.valueOf(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        } else if (defaultValue instanceof Boolean && value instanceof String) {
            return (T) Boolean.valueOf(value.toString().trim());
        } else if (defaultValue instanceof String) {
            return (T) value.toString();
        }
        return defaultValue;
    }
}
