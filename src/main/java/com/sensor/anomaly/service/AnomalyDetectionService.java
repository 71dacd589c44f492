package com.sensor.anomaly.service;

import com.sensor.anomaly.config.DetectionConfig;
import com.sensor.anomaly.config.MetricsConfig;
import com.sensor.anomaly.engine.AnomalyDetectionEngine;
import com.sensor.anomaly.model.DetectionConfigUpdate;
import com.sensor.anomaly.model.DetectionResult;
import com.sensor.anomaly.model.DetectionSettings;
import com.sensor.anomaly.model.Reading;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for the surrounding application.
 *
 * Flow:
 * 1. Snapshot the current configuration (plus any per-run overrides)
 * 2. Run the detection engine against the snapshot
 * 3. Record metrics and log the outcome
 *
 * Configuration updates are validated before being applied and never affect a run
 * that has already taken its snapshot. Prior results are not recomputed.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final AnomalyDetectionEngine engine;
    private final DetectionConfig detectionConfig;
    private final MetricsConfig metricsConfig;
    private final Object configLock = new Object();

    public AnomalyDetectionService(AnomalyDetectionEngine engine,
                                   DetectionConfig detectionConfig,
                                   MetricsConfig metricsConfig) {
        this.engine = engine;
        this.detectionConfig = detectionConfig;
        this.metricsConfig = metricsConfig;
    }

    public DetectionResult detect(List<Reading> readings) {
        return detect(readings, null);
    }

    /**
     * Analyze a batch of readings.
     *
     * @param readings  raw readings; null is treated as an empty batch
     * @param overrides optional values applied on top of the current configuration
     *                  for this run only; the stored configuration is left unchanged
     * @throws com.sensor.anomaly.config.InvalidDetectionConfigException if an override is invalid
     */
    @Observed(name = "anomaly.detect", contextualName = "detect-anomalies")
    public DetectionResult detect(List<Reading> readings, DetectionConfigUpdate overrides) {
        DetectionSettings settings = getConfig().applying(overrides);
        int readingCount = readings == null ? 0 : readings.size();
        log.info("Starting anomaly detection on {} readings", readingCount);

        DetectionResult result = engine.detect(readings, settings);

        metricsConfig.recordDetectionRun(readingCount, result);
        if (result.getSummary().getCriticalAnomalies() > 0) {
            log.warn("Critical anomalies detected: {} critical of {} total across {} entities",
                    result.getSummary().getCriticalAnomalies(),
                    result.getSummary().getTotalAnomalies(),
                    result.getSummary().getTotalEntities());
        }
        return result;
    }

    /**
     * Returns the current effective configuration.
     */
    public DetectionSettings getConfig() {
        synchronized (configLock) {
            return detectionConfig.snapshot();
        }
    }

    /**
     * Merge the non-null fields of {@code update} into the effective configuration.
     *
     * @throws com.sensor.anomaly.config.InvalidDetectionConfigException if any supplied value
     *         is invalid; in that case nothing is applied
     */
    public DetectionSettings updateConfig(DetectionConfigUpdate update) {
        DetectionSettings updated;
        synchronized (configLock) {
            updated = detectionConfig.snapshot().applying(update);
            detectionConfig.apply(updated);
        }
        metricsConfig.recordConfigUpdate();
        log.info("Anomaly detection configuration updated: {}", updated);
        return updated;
    }
}
