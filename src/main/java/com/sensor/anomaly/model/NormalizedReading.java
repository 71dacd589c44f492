package com.sensor.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A reading that passed validation. {@code value} is always finite.
 */
@Value
@Builder
public class NormalizedReading {
    Instant timestamp;
    String entityId;
    double value;
}
