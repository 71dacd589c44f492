package com.sensor.anomaly.engine;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Human-readable text for anomaly findings.
 */
public final class AnomalyDescriptions {

    private static final Pattern COMMON_DOMAIN = Pattern.compile("^(sensor|binary_sensor|switch|light)\\.");
    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private AnomalyDescriptions() {}

    public static String spike(String entityId, double value, double expected) {
        return String.format(Locale.ROOT, "%s spiked to %.2f (expected ~%.2f, +%s%% change)",
                displayName(entityId), value, expected, percentChange(value, expected));
    }

    public static String drop(String entityId, double value, double expected) {
        return String.format(Locale.ROOT, "%s dropped to %.2f (expected ~%.2f, %s%% change)",
                displayName(entityId), value, expected, percentChange(value, expected));
    }

    public static String gap(double gapHours) {
        return String.format(Locale.ROOT, "Data gap detected: %.1f hours without readings", gapHours);
    }

    public static String stuck(double value, double hours, int runLength) {
        return String.format(Locale.ROOT, "Sensor stuck at value %s for %.1f hours (%d readings)",
                plain(value), hours, runLength);
    }

    static String displayName(String entityId) {
        return COMMON_DOMAIN.matcher(entityId).replaceFirst("").replace('_', ' ');
    }

    public static double toHours(long millis) {
        return millis / MILLIS_PER_HOUR;
    }

    private static String percentChange(double value, double expected) {
        if (expected == 0) return "N/A";
        return String.format(Locale.ROOT, "%.1f", (value - expected) / expected * 100.0);
    }

    // 22.0 -> "22", 22.5 -> "22.5"
    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
