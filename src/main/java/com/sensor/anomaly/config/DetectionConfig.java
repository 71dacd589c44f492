package com.sensor.anomaly.config;

import com.sensor.anomaly.model.DetectionSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Externally supplied detection thresholds. Mutable at runtime through the
 * config API; runs never read it directly but work on a {@link DetectionSettings} snapshot.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Readings whose |z| exceeds this are flagged by the z-score method.
    private double zScoreThreshold = 2.5;

    // Tukey fence multiplier for the IQR method.
    private double iqrMultiplier = 1.5;

    // Entities with fewer valid readings get no statistics and no detection.
    private int minDataPoints = 5;

    // State values treated as invalid (compared case-insensitively).
    private Set<String> excludeStates = new LinkedHashSet<>(List.of(
            "unknown", "unavailable", "disabled", "none", "null",
            "error", "timeout", "disconnected", "offline", "fault"));

    // Entity domains (prefix before the first dot) that are never analyzed.
    private Set<String> excludeDomains = new LinkedHashSet<>(List.of(
            "automation", "script", "scene", "group", "zone",
            "device_tracker", "person", "input_boolean", "input_select",
            "input_text", "input_number", "input_datetime", "timer",
            "counter", "weather"));

    // When true, healthy means >= 4 readings in the trailing 24h of the batch.
    private boolean requireDailyReporting = false;

    // Size of the fixed pool used to fan out per-entity detection.
    private int workerThreads = Runtime.getRuntime().availableProcessors();

    public DetectionSettings snapshot() {
        return DetectionSettings.of(zScoreThreshold, iqrMultiplier, minDataPoints,
                excludeStates, excludeDomains, requireDailyReporting);
    }

    public void apply(DetectionSettings settings) {
        this.zScoreThreshold = settings.getZScoreThreshold();
        this.iqrMultiplier = settings.getIqrMultiplier();
        this.minDataPoints = settings.getMinDataPoints();
        this.excludeStates = new LinkedHashSet<>(settings.getExcludeStates());
        this.excludeDomains = new LinkedHashSet<>(settings.getExcludeDomains());
        this.requireDailyReporting = settings.isRequireDailyReporting();
    }
}
