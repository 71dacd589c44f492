package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
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
@Schema(description = "Distributional summary of one entity's readings, recomputed on every run")
public class EntityStats {

    @Schema(description = "Entity identifier", example = "sensor.living_room_temperature")
    private String entityId;

    @Schema(description = "Arithmetic mean", example = "21.4")
    private double mean;

    @Schema(description = "Median (average of the two middle values for even counts)", example = "21.5")
    private double median;

    @Schema(description = "Population standard deviation (divides by n)", example = "0.8")
    private double stdDev;

    @Schema(description = "Value at sorted index floor(n * 0.25)", example = "20.9")
    private double q1;

    @Schema(description = "Value at sorted index floor(n * 0.75)", example = "22.0")
    private double q3;

    @Schema(description = "q3 - q1", example = "1.1")
    private double iqr;

    @Schema(description = "Number of valid readings for the entity", example = "288")
    private int dataPoints;

    @Schema(description = "Latest reading timestamp", example = "2025-02-18T14:30:00Z")
    private Instant lastReporting;

    @Schema(description = "Average readings per day", example = "288.0")
    private double reportingFrequency;

    @Schema(description = "Whether the entity meets the data sufficiency / daily reporting criteria", example = "true")
    @JsonProperty("isHealthy")
    private boolean healthy;
}
