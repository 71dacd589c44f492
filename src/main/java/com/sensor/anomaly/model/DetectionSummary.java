package com.sensor.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Aggregate counts for a detection run")
public class DetectionSummary {

    @Schema(description = "Entities with enough data to be analyzed", example = "12")
    private int totalEntities;

    @Schema(description = "Analyzed entities marked healthy", example = "11")
    private int healthyEntities;

    @Schema(description = "Anomalies after deduplication", example = "7")
    private int totalAnomalies;

    @Schema(description = "Critical anomalies", example = "1")
    private int criticalAnomalies;

    @Schema(description = "High severity anomalies", example = "2")
    private int highSeverityAnomalies;

    @Schema(description = "Medium severity anomalies", example = "3")
    private int mediumSeverityAnomalies;

    @Schema(description = "Low severity anomalies", example = "1")
    private int lowSeverityAnomalies;

    @Schema(description = "Anomaly count per detection method", example = "{\"z-score\": 3, \"missing-data\": 4}")
    @Builder.Default
    private Map<String, Long> detectionMethods = new LinkedHashMap<>();

    @Schema(description = "Anomaly count per entity", example = "{\"sensor.x\": 2}")
    @Builder.Default
    private Map<String, Long> anomaliesByEntity = new LinkedHashMap<>();

    public static DetectionSummary empty() {
        return DetectionSummary.builder().build();
    }
}
