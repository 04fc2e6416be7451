package com.di.dataqc.rule;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One option in a {@link ConfigSchema}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConfigProperty {

    /** JSON type name: string, number, integer, boolean, array, object. */
    String type;

    String description;

    @JsonProperty("enum")
    List<String> allowedValues;

    @JsonProperty("default")
    Object defaultValue;

    Double minimum;

    Double maximum;

    /** Element type for arrays. */
    String items;

    public static ConfigProperty string(String description) {
        return ConfigProperty.builder().type("string").description(description).build();
    }

    public static ConfigProperty stringList(String description) {
        return ConfigProperty.builder().type("array").items("string").description(description).build();
    }

    public static ConfigProperty number(String description) {
        return ConfigProperty.builder().type("number").description(description).build();
    }

    public static ConfigProperty flag(String description, boolean defaultValue) {
        return ConfigProperty.builder().type("boolean").description(description).defaultValue(defaultValue).build();
    }

    public static ConfigProperty choice(String description, List<String> values, String defaultValue) {
        return ConfigProperty.builder().type("string").description(description)
                .allowedValues(values).defaultValue(defaultValue).build();
    }
}
