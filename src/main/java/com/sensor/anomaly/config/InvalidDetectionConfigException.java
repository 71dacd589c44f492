package com.sensor.anomaly.config;

/**
 * Raised when a configuration update carries a value no run may use.
 * The update is rejected as a whole; nothing is applied.
 */
public class InvalidDetectionConfigException extends IllegalArgumentException {

    private final String field;

    public InvalidDetectionConfigException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
