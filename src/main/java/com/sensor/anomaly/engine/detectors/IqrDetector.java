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
 * Flags readings outside the Tukey fences.
 *
 * Logic: lower = q1 - k*iqr, upper = q3 + k*iqr. A reading strictly outside
 * [lower, upper] is flagged. Deviation is the distance past the violated fence;
 * severity is graded on deviation / iqr and confidence on deviation / (k*iqr).
 *
 * Example: q1 = 10, q3 = 14, k = 1.5 gives fences [4, 20]. A reading of 31 is
 * 11 past the upper fence: 11 / 4 = 2.75 is HIGH, confidence min(11 / 6, 1) = 1.0.
 */
@Component
public class IqrDetector implements AnomalyDetector {

    @Override
    public DetectionMethod getSupportedMethod() {
        return DetectionMethod.IQR;
    }

    @Override
    public List<Anomaly> detect(List<NormalizedReading> readings, EntityStats stats, DetectionSettings settings) {
        double iqr = stats.getIqr();
        if (iqr == 0) {
            return List.of();
        }

        double multiplier = settings.getIqrMultiplier();
        double lowerBound = stats.getQ1() - multiplier * iqr;
        double upperBound = stats.getQ3() + multiplier * iqr;
        double median = stats.getMedian();
        List<Anomaly> anomalies = new ArrayList<>();

        for (NormalizedReading reading : readings) {
            double value = reading.getValue();
            if (value >= lowerBound && value <= upperBound) continue;

            boolean above = value > upperBound;
            double deviation = above ? value - upperBound : lowerBound - value;
            AnomalyType type = above ? AnomalyType.SPIKE : AnomalyType.DROP;
            String description = above
                    ? AnomalyDescriptions.spike(reading.getEntityId(), value, median)
                    : AnomalyDescriptions.drop(reading.getEntityId(), value, median);

            anomalies.add(Anomaly.builder()
                    .id(Anomaly.buildId(DetectionMethod.IQR, reading.getEntityId(), reading.getTimestamp()))
                    .timestamp(reading.getTimestamp())
                    .entityId(reading.getEntityId())
                    .value(value)
                    .expectedValue(median)
                    .deviation(deviation)
                    .severity(severityFor(deviation / iqr))
                    .type(type)
                    .description(description)
                    .confidence(Math.min(deviation / (iqr * multiplier), 1.0))
                    .method(DetectionMethod.IQR)
                    .build());
        }
        return anomalies;
    }

    static Severity severityFor(double iqrRatio) {
        if (iqrRatio > 3) return Severity.CRITICAL;
        if (iqrRatio > 2.5) return Severity.HIGH;
        if (iqrRatio > 2) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
