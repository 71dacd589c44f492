package com.sensor.anomaly.controller;

import com.sensor.anomaly.config.InvalidDetectionConfigException;
import com.sensor.anomaly.model.DetectionConfigUpdate;
import com.sensor.anomaly.model.DetectionSettings;
import com.sensor.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify the detection thresholds")
public class ConfigController {

    private final AnomalyDetectionService detectionService;

    public ConfigController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    // ── Detection ──

    @Operation(summary = "Get the effective detection configuration")
    @GetMapping("/detection")
    public ResponseEntity<Map<String, Object>> getDetectionConfig() {
        return ResponseEntity.ok(toBody(detectionService.getConfig()));
    }

    @Operation(summary = "Update the detection configuration",
            description = "Partial update; omitted fields keep their value. Changes apply to " +
                    "subsequent runs only and reset on restart.")
    @PutMapping("/detection")
    public ResponseEntity<?> updateDetectionConfig(@RequestBody Map<String, Object> body) {
        try {
            DetectionConfigUpdate update = DetectionConfigUpdate.builder()
                    .zScoreThreshold(toDouble(body, "zScoreThreshold"))
                    .iqrMultiplier(toDouble(body, "iqrMultiplier"))
                    .minDataPoints(toInt(body, "minDataPoints"))
                    .excludeStates(toStringSet(body, "excludeStates"))
                    .excludeDomains(toStringSet(body, "excludeDomains"))
                    .requireDailyReporting(toBoolean(body, "requireDailyReporting"))
                    .build();
            return ResponseEntity.ok(toBody(detectionService.updateConfig(update)));
        } catch (InvalidDetectionConfigException e) {
            return badRequest(e.getMessage(), e.getField());
        }
    }

    // ── Helpers ──

    private Map<String, Object> toBody(DetectionSettings settings) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("zScoreThreshold", settings.getZScoreThreshold());
        body.put("iqrMultiplier", settings.getIqrMultiplier());
        body.put("minDataPoints", settings.getMinDataPoints());
        body.put("excludeStates", settings.getExcludeStates());
        body.put("excludeDomains", settings.getExcludeDomains());
        body.put("requireDailyReporting", settings.isRequireDailyReporting());
        return body;
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private Double toDouble(Map<String, Object> body, String key) {
        Object v = body.get(key);
        if (v == null) return null;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) {
            throw new InvalidDetectionConfigException(key, key + " must be a number");
        }
    }

    private Integer toInt(Map<String, Object> body, String key) {
        Object v = body.get(key);
        if (v == null) return null;
        if (v instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                throw new InvalidDetectionConfigException(key, key + " must be an integer");
            }
            return (int) d;
        }
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) {
            throw new InvalidDetectionConfigException(key, key + " must be an integer");
        }
    }

    private Boolean toBoolean(Map<String, Object> body, String key) {
        Object v = body.get(key);
        if (v == null) return null;
        if (v instanceof Boolean b) return b;
        String s = v.toString();
        if ("true".equalsIgnoreCase(s)) return true;
        if ("false".equalsIgnoreCase(s)) return false;
        throw new InvalidDetectionConfigException(key, key + " must be true or false");
    }

    private Set<String> toStringSet(Map<String, Object> body, String key) {
        Object raw = body.get(key);
        if (raw == null) return null;
        if (!(raw instanceof List<?> rawList)) {
            throw new InvalidDetectionConfigException(key, key + " must be a list");
        }
        Set<String> values = new LinkedHashSet<>();
        for (Object item : rawList) {
            values.add(item == null ? null : item.toString());
        }
        return values;
    }
}
