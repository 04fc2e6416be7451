package com.di.dataqc.rule;

import com.di.dataqc.exception.RuleConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view over a rule's option map with typed accessors.
 * <p>
 * An option counts as absent when the key is missing, its value is {@code null}, or it is a blank string
 * (forms submit empty inputs that way). Values of the wrong shape raise {@link RuleConfigurationException}.
 */
public final class RuleConfig {

    private final Map<String, Object> values;

    private RuleConfig(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static RuleConfig of(Map<String, ?> values) {
        return new RuleConfig(values == null ? Map.of() : new LinkedHashMap<>(values));
    }

    public static RuleConfig empty() {
        return new RuleConfig(Map.of());
    }

    public boolean has(String key) {
        Object value = values.get(key);
        if (value == null) {
            return false;
        }
        return !(value instanceof String) || !((String) value).isBlank();
    }

    public Object get(String key) {
        return has(key) ? values.get(key) : null;
    }

    public Object require(String key) {
        if (!has(key)) {
            throw RuleConfigurationException.missingField(key);
        }
        return values.get(key);
    }

    public String getString(String key) {
        Object value = get(key);
        return value == null ? null : value.toString();
    }

    public String getString(String key, String defaultValue) {
        String value = getString(key);
        return value != null ? value : defaultValue;
    }

    public String requireString(String key) {
        return require(key).toString();
    }

    public Double getDouble(String key) {
        Object value = get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new RuleConfigurationException("Config field '" + key + "' must be a number, got: " + value, e);
        }
    }

    public double getDouble(String key, double defaultValue) {
        Double value = getDouble(key);
        return value != null ? value : defaultValue;
    }

    public Long getLong(String key) {
        Double value = getDouble(key);
        if (value == null) {
            return null;
        }
        if (value != Math.rint(value)) {
            throw new RuleConfigurationException("Config field '" + key + "' must be an integer, got: " + value);
        }
        return value.longValue();
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new RuleConfigurationException("Config field '" + key + "' must be a boolean, got: " + value);
    }

    /** The option as a list; a missing option yields an empty list, a non-list value is a configuration error. */
    public List<Object> getList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new RuleConfigurationException("Config field '" + key + "' must be a list, got: " + value);
        }
        return Collections.unmodifiableList(new ArrayList<>((List<?>) value));
    }

    public List<String> getStringList(String key) {
        List<Object> raw = getList(key);
        List<String> out = new ArrayList<>(raw.size());
        for (Object item : raw) {
            if (item == null) {
                throw new RuleConfigurationException("Config field '" + key + "' contains a null entry");
            }
            out.add(item.toString());
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new RuleConfigurationException("Config field '" + key + "' must be an object, got: " + value);
        }
        return (Map<String, Object>) value;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
