package com.di.dataqc.reconcile;

import com.di.dataqc.exception.RuleConfigurationException;

import java.util.Locale;

/**
 * Unit of a date tolerance.
 */
public enum DateUnit {
    DAYS("days", 86_400L),
    HOURS("hours", 3_600L),
    MINUTES("minutes", 60L);

    private final String id;
    private final long seconds;

    DateUnit(String id, long seconds) {
        this.id = id;
        this.seconds = seconds;
    }

    public String id() {
        return id;
    }

    /** {@code amount} of this unit in seconds. */
    public double toSeconds(double amount) {
        return amount * seconds;
    }

    public static DateUnit fromId(String id) {
        if (id == null || id.isBlank()) {
            return DAYS;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (DateUnit unit : values()) {
            if (unit.id.equals(normalized) || unit.id.equals(normalized + "s")) {
                return unit;
            }
        }
        throw new RuleConfigurationException("Unknown date unit: " + id + ". Supported: [days, hours, minutes]");
    }
}
