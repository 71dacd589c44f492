package com.sensor.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single explainable anomaly finding")
public class Anomaly {

    @Schema(description = "Deterministic id built from method, entity and timestamp",
            example = "zscore_sensor.living_room_temperature_2025-02-18T14:30:00Z")
    private String id;

    @Schema(description = "Timestamp the finding is anchored at", example = "2025-02-18T14:30:00Z")
    private Instant timestamp;

    @Schema(description = "Entity identifier", example = "sensor.living_room_temperature")
    private String entityId;

    @Schema(description = "Observed value (0 for missing-data findings)", example = "35.0")
    private double value;

    @Schema(description = "Value the method expected (1 for missing-data findings)", example = "20.0")
    private double expectedValue;

    @Schema(description = "Method-specific non-negative deviation", example = "15.0")
    private double deviation;

    @Schema(description = "Severity", example = "critical", allowableValues = {"low", "medium", "high", "critical"})
    private Severity severity;

    @Schema(description = "Anomaly type", example = "spike", allowableValues = {"spike", "drop", "missing", "stuck"})
    private AnomalyType type;

    @Schema(description = "Human-readable explanation",
            example = "living room temperature spiked to 35.00 (expected ~20.00, +75.0% change)")
    private String description;

    @Schema(description = "Heuristic strength score in [0, 1]", example = "1.0")
    private double confidence;

    @Schema(description = "Detection method", example = "z-score", allowableValues = {"z-score", "iqr", "missing-data", "pattern"})
    private DetectionMethod method;

    public static String buildId(DetectionMethod method, String entityId, Instant timestamp) {
        return method.getIdPrefix() + "_" + entityId + "_" + timestamp;
    }
}
