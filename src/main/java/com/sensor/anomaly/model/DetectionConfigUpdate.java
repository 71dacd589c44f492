package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.sensor.anomaly.config.InvalidDetectionConfigException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Objects;
import java.util.Set;

/**
 * Partial configuration. Null fields keep the current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@Schema(description = "Partial detection configuration; omitted fields are left unchanged")
public class DetectionConfigUpdate {

    @Schema(description = "Z-score above which a reading is flagged (> 0)", example = "2.5")
    private Double zScoreThreshold;

    @Schema(description = "Tukey fence multiplier (> 0)", example = "1.5")
    private Double iqrMultiplier;

    @Schema(description = "Minimum readings per entity before statistics are trusted (>= 1)", example = "5")
    private Integer minDataPoints;

    @Schema(description = "States treated as invalid, case-insensitive", example = "[\"unknown\", \"unavailable\"]")
    private Set<String> excludeStates;

    @Schema(description = "Entity domains excluded entirely", example = "[\"automation\", \"scene\"]")
    private Set<String> excludeDomains;

    @Schema(description = "Require >= 4 readings in the trailing 24h for healthy status", example = "false")
    private Boolean requireDailyReporting;

    public void validate() {
        if (zScoreThreshold != null && !isPositiveFinite(zScoreThreshold)) {
            throw new InvalidDetectionConfigException("zScoreThreshold", "zScoreThreshold must be a finite number > 0");
        }
        if (iqrMultiplier != null && !isPositiveFinite(iqrMultiplier)) {
            throw new InvalidDetectionConfigException("iqrMultiplier", "iqrMultiplier must be a finite number > 0");
        }
        if (minDataPoints != null && minDataPoints < 1) {
            throw new InvalidDetectionConfigException("minDataPoints", "minDataPoints must be >= 1");
        }
        if (excludeStates != null && excludeStates.stream().anyMatch(Objects::isNull)) {
            throw new InvalidDetectionConfigException("excludeStates", "excludeStates must not contain null entries");
        }
        if (excludeDomains != null && excludeDomains.stream().anyMatch(Objects::isNull)) {
            throw new InvalidDetectionConfigException("excludeDomains", "excludeDomains must not contain null entries");
        }
    }

    private static boolean isPositiveFinite(double value) {
        return value > 0 && Double.isFinite(value);
    }
}
