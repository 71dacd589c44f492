package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The closed set of detection strategies. Each method is handled by exactly one
 * registered {@link com.sensor.anomaly.engine.AnomalyDetector}; declaration order
 * is the order in which an entity's findings are pooled before deduplication.
 */
public enum DetectionMethod {
    Z_SCORE("z-score", "zscore"),
    IQR("iqr", "iqr"),
    MISSING_DATA("missing-data", "missing"),
    PATTERN("pattern", "stuck");

    private final String label;
    private final String idPrefix;

    DetectionMethod(String label, String idPrefix) {
        this.label = label;
        this.idPrefix = idPrefix;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String getIdPrefix() {
        return idPrefix;
    }
}
