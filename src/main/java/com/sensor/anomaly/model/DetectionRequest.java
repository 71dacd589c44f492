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
@Schema(description = "A batch of readings to analyze, with optional per-run config overrides")
public class DetectionRequest {

    @Schema(description = "Raw readings, any order")
    @Builder.Default
    private List<Reading> readings = new ArrayList<>();

    @Schema(description = "Overrides applied to the current configuration for this run only")
    private DetectionConfigUpdate config;
}
