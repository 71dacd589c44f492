package com.sensor.anomaly.controller;

import com.sensor.anomaly.config.InvalidDetectionConfigException;
import com.sensor.anomaly.model.DetectionRequest;
import com.sensor.anomaly.model.DetectionResult;
import com.sensor.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Run anomaly detection over a batch of sensor readings")
public class DetectionController {

    private final AnomalyDetectionService detectionService;

    public DetectionController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Operation(summary = "Detect anomalies in a batch of readings",
            description = "Invalid readings are dropped silently. An empty or fully invalid batch " +
                    "returns empty lists and a zero-filled summary. Optional `config` overrides " +
                    "apply to this run only.")
    @ApiResponse(responseCode = "200", description = "Detection result",
            content = @Content(schema = @Schema(implementation = DetectionResult.class)))
    @ApiResponse(responseCode = "400", description = "Invalid config override")
    @PostMapping("/detect")
    public ResponseEntity<?> detect(@RequestBody DetectionRequest request) {
        try {
            DetectionResult result = detectionService.detect(request.getReadings(), request.getConfig());
            return ResponseEntity.ok(result);
        } catch (InvalidDetectionConfigException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", e.getField()));
        }
    }
}
