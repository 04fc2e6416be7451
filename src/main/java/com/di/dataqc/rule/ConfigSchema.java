package com.di.dataqc.rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared options of a rule: {@code {type: "object", properties: {...}, required: [...]}}.
 */
public final class ConfigSchema {

    private final Map<String, ConfigProperty> properties;
    private final List<String> required;

    private ConfigSchema(Map<String, ConfigProperty> properties, List<String> required) {
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.required = List.copyOf(required);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getType() {
        return "object";
    }

    public Map<String, ConfigProperty> getProperties() {
        return properties;
    }

    public List<String> getRequired() {
        return required;
    }

    public static final class Builder {
        private final Map<String, ConfigProperty> properties = new LinkedHashMap<>();
        private final List<String> required = new ArrayList<>();

        private Builder() {
        }

        public Builder property(String name, ConfigProperty property) {
            properties.put(name, property);
            return this;
        }

        public Builder required(String name, ConfigProperty property) {
            properties.put(name, property);
            required.add(name);
            return this;
        }

        public ConfigSchema build() {
            return new ConfigSchema(properties, required);
        }
    }
}
