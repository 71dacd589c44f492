package com.sensor.anomaly.engine;

import com.sensor.anomaly.model.Anomaly;
import com.sensor.anomaly.model.DetectionMethod;
import com.sensor.anomaly.model.DetectionSettings;
import com.sensor.anomaly.model.EntityStats;
import com.sensor.anomaly.model.NormalizedReading;

import java.util.List;

/**
 * Interface for all detection strategies.
 * Each implementation handles a specific DetectionMethod.
 */
public interface AnomalyDetector {

    /**
     * The detection method this detector implements.
     */
    DetectionMethod getSupportedMethod();

    /**
     * Detect anomalies in one entity's readings.
     *
     * @param readings the entity's normalized readings, in input order; never modified
     * @param stats    statistics computed over the same readings
     * @param settings the run's configuration snapshot
     * @return findings for this entity, possibly empty
     */
    List<Anomaly> detect(List<NormalizedReading> readings, EntityStats stats, DetectionSettings settings);
}
