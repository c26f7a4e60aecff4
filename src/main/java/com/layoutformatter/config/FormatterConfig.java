package com.layoutformatter.config;

import java.util.HashMap;
import java.util.Map;

/**
 * The fixed set of named formatter options: general layout settings plus one section
 * per correction pass.
 */
public class FormatterConfig {
    public static final String ALIGNMENT = "alignment";
    public static final String CALL_SHAPE = "callShape";
    public static final String COMPACTION = "compaction";

    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> passConfigs;

    public FormatterConfig(Map<String, Object> generalConfig,
                           Map<String, Map<String, Object>> passConfigs) {
        this.generalConfig = new HashMap<>(generalConfig);
        this.passConfigs = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : passConfigs.entrySet()) {
            this.passConfigs.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
    }

    public int getPrintWidth() {
        return getGeneralConfig("printWidth", 80);
    }

    public int getIndentSize() {
        return getGeneralConfig("indentSize", 2);
    }

    public boolean isPassEnabled(String pass) {
        return getPassConfig(pass, "enabled", true);
    }

    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    public Map<String, Map<String, Object>> getPassConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : passConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    public <T> T getGeneralConfig(String key, T defaultValue) {
        return convert(generalConfig.get(key), defaultValue);
    }

    public <T> T getPassConfig(String pass, String key, T defaultValue) {
        Map<String, Object> passConfig = passConfigs.get(pass);
        if (passConfig == null) {
            return defaultValue;
        }
        return convert(passConfig.get(key), defaultValue);
    }

    @SuppressWarnings("unchecked")
    private static <T> T convert(Object value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue == null || defaultValue.getClass().isInstance(value)) {
            return (T) value;
        }

        if (defaultValue instanceof Integer && value instanceof Number) {
            return (T) Integer.valueOf(((Number) value).intValue());
        } else if (defaultValue instanceof Boolean && value instanceof String) {
            return (T) Boolean.valueOf(value.toString());
        } else if (defaultValue instanceof String) {
            return (T) value.toString();
        }
        return defaultValue;
    }
}
