package com.di.dataqc.formula;

import com.di.dataqc.exception.RuleConfigurationException;

import java.util.Locale;

/**
 * How rows of the two formula operands are paired.
 */
public enum MatchBy {
    /** Row i with row i, up to the shorter dataset. */
    INDEX,
    /** Inner match on key columns, first row per key on each side. */
    KEY;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MatchBy fromId(String id) {
        if (id == null || id.isBlank()) {
            return INDEX;
        }
        String normalized = id.trim().toUpperCase(Locale.ROOT);
        for (MatchBy matchBy : values()) {
            if (matchBy.name().equals(normalized)) {
                return matchBy;
            }
        }
        throw new RuleConfigurationException("Unknown match_by: " + id + ". Supported: [index, key]");
    }
}
