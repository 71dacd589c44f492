package com.sensor.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Output of one detection run: ranked anomalies, per-entity statistics and summary")
public class DetectionResult {

    @Schema(description = "Deduplicated anomalies, severity descending then most recent first")
    @Builder.Default
    private List<Anomaly> anomalies = new ArrayList<>();

    @Schema(description = "Statistics for every entity with enough data")
    @Builder.Default
    private List<EntityStats> entityStats = new ArrayList<>();

    @Schema(description = "Aggregate counts")
    @Builder.Default
    private DetectionSummary summary = DetectionSummary.empty();

    public static DetectionResult empty() {
        return DetectionResult.builder().build();
    }
}
