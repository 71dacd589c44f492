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
 * Detects reporting gaps: consecutive readings further apart than
 * {@value #TOLERANCE_FACTOR}x the entity's average interval.
 *
 * Each finding is anchored at the reading before the gap. Value and expected value
 * are the presence sentinels 0 and 1; deviation is the gap length in hours.
 */
@Component
public class MissingDataDetector implements AnomalyDetector {

    static final double TOLERANCE_FACTOR = 3.0;

    @Override
    public DetectionMethod getSupportedMethod() {
        return DetectionMethod.MISSING_DATA;
    }

    @Override
    public List<Anomaly> detect(List<NormalizedReading> readings, EntityStats stats, DetectionSettings settings) {
        if (readings.size() < 2) {
            return List.of();
        }

        List<NormalizedReading> sorted = new ArrayList<>(readings);
        sorted.sort(Comparator.comparing(NormalizedReading::getTimestamp));

        long[] intervals = new long[sorted.size() - 1];
        double total = 0;
        for (int i = 1; i < sorted.size(); i++) {
            intervals[i - 1] = sorted.get(i).getTimestamp().toEpochMilli()
                    - sorted.get(i - 1).getTimestamp().toEpochMilli();
            total += intervals[i - 1];
        }
        double expectedInterval = (total / intervals.length) * TOLERANCE_FACTOR;

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < intervals.length; i++) {
            long actual = intervals[i];
            if (actual <= expectedInterval) continue;

            NormalizedReading before = sorted.get(i);
            double gapHours = AnomalyDescriptions.toHours(actual);

            anomalies.add(Anomaly.builder()
                    .id(Anomaly.buildId(DetectionMethod.MISSING_DATA, before.getEntityId(), before.getTimestamp()))
                    .timestamp(before.getTimestamp())
                    .entityId(before.getEntityId())
                    .value(0)
                    .expectedValue(1)
                    .deviation(gapHours)
                    .severity(Severity.fromDurationHours(gapHours))
                    .type(AnomalyType.MISSING)
                    .description(AnomalyDescriptions.gap(gapHours))
                    .confidence(Math.min(actual / expectedInterval - 1, 1.0))
                    .method(DetectionMethod.MISSING_DATA)
                    .build());
        }
        return anomalies;
    }
}
