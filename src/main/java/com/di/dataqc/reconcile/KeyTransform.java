package com.di.dataqc.reconcile;

import com.di.dataqc.exception.RuleConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * String transforms applied, in configured order, to each key part before matching.
 */
public enum KeyTransform {
    TRIM("trim") {
        @Override
        public String apply(String value) {
            return value.strip();
        }
    },
    LOWER("lower") {
        @Override
        public String apply(String value) {
            return value.toLowerCase(Locale.ROOT);
        }
    },
    UPPER("upper") {
        @Override
        public String apply(String value) {
            return value.toUpperCase(Locale.ROOT);
        }
    },
    REMOVE_SPECIAL("remove_special") {
        @Override
        public String apply(String value) {
            return SPECIAL.matcher(value).replaceAll("");
        }
    },
    NORMALIZE_SPACES("normalize_spaces") {
        @Override
        public String apply(String value) {
            return WHITESPACE.matcher(value).replaceAll(" ").strip();
        }
    };

    private static final Pattern SPECIAL = Pattern.compile("[^A-Za-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String id;

    KeyTransform(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public abstract String apply(String value);

    public static KeyTransform fromId(String id) {
        String normalized = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        for (KeyTransform transform : values()) {
            if (transform.id.equals(normalized)) {
                return transform;
            }
        }
        throw new RuleConfigurationException(String.format("Unknown transformation: %s. Supported: %s", id,
                Arrays.stream(values()).map(KeyTransform::id).collect(Collectors.toList())));
    }
}
