package com.di.dataqc.rule;

import com.di.dataqc.exception.RuleConfigurationException;

import java.util.Locale;

/**
 * How a tolerance amount is interpreted.
 */
public enum ToleranceType {
    /** Fixed amount in the unit of the compared values. */
    ABSOLUTE("absolute"),
    /** Percentage of a reference magnitude. */
    PERCENTAGE("percentage");

    private final String id;

    ToleranceType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static ToleranceType fromId(String id) {
        if (id == null || id.isBlank()) {
            return ABSOLUTE;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        if ("percent".equals(normalized)) {
            return PERCENTAGE;
        }
        for (ToleranceType t : values()) {
            if (t.id.equals(normalized)) {
                return t;
            }
        }
        throw new RuleConfigurationException("Unknown tolerance type: " + id + ". Supported: [absolute, percentage]");
    }
}
