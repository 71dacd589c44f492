package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordinal importance of an anomaly. Declaration order is ascending, so the
 * natural enum order can be used directly for ranking.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Severity for a duration-based finding (data gaps, stuck runs).
     * Both boundaries are exclusive: exactly 6h is LOW, exactly 24h is MEDIUM.
     */
    public static Severity fromDurationHours(double hours) {
        if (hours > 24) return HIGH;
        if (hours > 6) return MEDIUM;
        return LOW;
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
