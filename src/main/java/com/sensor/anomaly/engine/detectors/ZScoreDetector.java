package com.sensor.anomaly.engine.detectors;

import com.sensor.anomaly.engine.AnomalyDescriptions;
import com.sensor.anomaly.engine.AnomalyDetector;
import com.sensor.anomaly.model.Anomaly;
import com.sensor.anomaly.model.AnomalyType;
import com.sensor.anomaly.model.DetectionMethod;
import com.sensor.anomaly.model.DetectionSettings;
import com.sensor.anomaly.model.EntityStats;
import com.sensor.anomaly.model.NormalizedReading;
import com.sensor.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags readings that lie far from the entity's mean in units of standard deviation.
 *
 * Logic: z = |value - mean| / stdDev. If z > zScoreThreshold, flag it.
 * Confidence is z relative to the threshold, capped at 1.
 *
 * Example: mean 20.0, stdDev 1.0, threshold 2.5. A reading of 35.0 has z = 15,
 * which is CRITICAL (z > 4) with confidence min(15 / 2.5, 1) = 1.0.
 */
@Component
public class ZScoreDetector implements AnomalyDetector {

    @Override
    public DetectionMethod getSupportedMethod() {
        return DetectionMethod.Z_SCORE;
    }

    @Override
    public List<Anomaly> detect(List<NormalizedReading> readings, EntityStats stats, DetectionSettings settings) {
        // A constant signal has no z-score outliers.
        if (!(stats.getStdDev() > 0)) {
            return List.of();
        }

        double mean = stats.getMean();
        double threshold = settings.getZScoreThreshold();
        List<Anomaly> anomalies = new ArrayList<>();

        for (NormalizedReading reading : readings) {
            double deviation = Math.abs(reading.getValue() - mean);
            double zScore = deviation / stats.getStdDev();
            if (zScore <= threshold) continue;

            AnomalyType type = reading.getValue() > mean ? AnomalyType.SPIKE : AnomalyType.DROP;
            String description = type == AnomalyType.SPIKE
                    ? AnomalyDescriptions.spike(reading.getEntityId(), reading.getValue(), mean)
                    : AnomalyDescriptions.drop(reading.getEntityId(), reading.getValue(), mean);

            anomalies.add(Anomaly.builder()
                    .id(Anomaly.buildId(DetectionMethod.Z_SCORE, reading.getEntityId(), reading.getTimestamp()))
                    .timestamp(reading.getTimestamp())
                    .entityId(reading.getEntityId())
                    .value(reading.getValue())
                    .expectedValue(mean)
                    .deviation(deviation)
                    .severity(severityFor(zScore))
                    .type(type)
                    .description(description)
                    .confidence(Math.min(zScore / threshold, 1.0))
                    .method(DetectionMethod.Z_SCORE)
                    .build());
        }
        return anomalies;
    }

    static Severity severityFor(double zScore) {
        if (zScore > 4) return Severity.CRITICAL;
        if (zScore > 3.5) return Severity.HIGH;
        if (zScore > 3) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
