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
import java.util.Comparator;
import java.util.List;

/**
 * Detects stuck sensors: runs of at least {@value #MIN_RUN_LENGTH} exactly equal
 * consecutive values in timestamp order. No tolerance band is applied.
 *
 * Severity follows the time the run spans; confidence is runLength / 20, capped at 1.
 */
@Component
public class StuckValueDetector implements AnomalyDetector {

    static final int MIN_READINGS = 5;
    static final int MIN_RUN_LENGTH = 10;
    static final double FULL_CONFIDENCE_RUN_LENGTH = 20.0;

    @Override
    public DetectionMethod getSupportedMethod() {
        return DetectionMethod.PATTERN;
    }

    @Override
    public List<Anomaly> detect(List<NormalizedReading> readings, EntityStats stats, DetectionSettings settings) {
        if (readings.size() < MIN_READINGS) {
            return List.of();
        }

        List<NormalizedReading> sorted = new ArrayList<>(readings);
        sorted.sort(Comparator.comparing(NormalizedReading::getTimestamp));

        List<Anomaly> anomalies = new ArrayList<>();
        int runStart = 0;
        for (int i = 1; i <= sorted.size(); i++) {
            boolean runContinues = i < sorted.size()
                    && sorted.get(i).getValue() == sorted.get(runStart).getValue();
            if (runContinues) continue;

            int runLength = i - runStart;
            if (runLength >= MIN_RUN_LENGTH) {
                anomalies.add(toAnomaly(sorted.get(runStart), sorted.get(i - 1), runLength));
            }
            runStart = i;
        }
        return anomalies;
    }

    private Anomaly toAnomaly(NormalizedReading first, NormalizedReading last, int runLength) {
        double hours = AnomalyDescriptions.toHours(
                last.getTimestamp().toEpochMilli() - first.getTimestamp().toEpochMilli());
        double stuckValue = first.getValue();

        return Anomaly.builder()
                .id(Anomaly.buildId(DetectionMethod.PATTERN, first.getEntityId(), first.getTimestamp()))
                .timestamp(first.getTimestamp())
                .entityId(first.getEntityId())
                .value(stuckValue)
                .expectedValue(stuckValue)
                .deviation(runLength)
                .severity(Severity.fromDurationHours(hours))
                .type(AnomalyType.STUCK)
                .description(AnomalyDescriptions.stuck(stuckValue, hours, runLength))
                .confidence(Math.min(runLength / FULL_CONFIDENCE_RUN_LENGTH, 1.0))
                .method(DetectionMethod.PATTERN)
                .build();
    }
}
