package com.sqconfig.core.model;

import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.SqConfigException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Read-only audit thresholds. Defaults come from the classpath resource
 * {@value #DEFAULTS_RESOURCE}; overrides replace individual keys.
 */
public final class AuditSettings {

    public static final String DEFAULTS_RESOURCE = "/sqconfig-audit.properties";

    private final Map<String, String> values;

    private AuditSettings(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static AuditSettings defaults() {
        var properties = new Properties();
        try (InputStream in = AuditSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new SqConfigException(ErrorCode.OS_ERROR, "Missing resource " + DEFAULTS_RESOURCE);
            }
            properties.load(in);
        } catch (IOException e) {
            throw new SqConfigException(ErrorCode.OS_ERROR, "Cannot read " + DEFAULTS_RESOURCE, e);
        }
        var map = new HashMap<String, String>();
        properties.stringPropertyNames().forEach(k -> map.put(k, properties.getProperty(k).trim()));
        return new AuditSettings(map);
    }

    public static AuditSettings of(Map<String, String> values) {
        return new AuditSettings(new HashMap<>(values));
    }

    public AuditSettings withOverrides(Map<String, String> overrides) {
        var merged = new HashMap<>(values);
        merged.putAll(overrides);
        return new AuditSettings(merged);
    }

    public int getInt(String key, int defaultValue) {
        var value = values.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new SqConfigException(ErrorCode.ARGS_ERROR,
                    "Audit setting %s must be an integer, got '%s'".formatted(key, value));
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        var value = values.get(key);
        return value == null || value.isBlank() ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    /**
     * Whether audit of the given object type is enabled ({@code audit.<section>}).
     */
    public boolean isEnabled(ObjectType type) {
        return getBoolean("audit." + type.section(), true);
    }

    public Map<String, String> asMap() {
        return values;
    }
}
