package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnomalyType {
    SPIKE,
    DROP,
    MISSING,
    STUCK;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
