package com.sensor.anomaly.engine;

import com.sensor.anomaly.model.DetectionSettings;
import com.sensor.anomaly.model.EntityStats;
import com.sensor.anomaly.model.NormalizedReading;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Groups normalized readings by entity and computes per-entity distributional statistics.
 *
 * Quartiles are taken at sorted indices floor(n*0.25) and floor(n*0.75) without
 * interpolation, and the standard deviation is the population one (divides by n).
 * The IQR severity thresholds are calibrated against these exact definitions.
 */
@Component
public class EntityStatisticsCalculator {

    static final int DAILY_REPORTING_MIN_READINGS = 4;
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    /**
     * Partition readings by entity id, keeping first-appearance order of entities
     * and input order of readings within each entity.
     */
    public Map<String, List<NormalizedReading>> groupByEntity(List<NormalizedReading> readings) {
        Map<String, List<NormalizedReading>> grouped = new LinkedHashMap<>();
        for (NormalizedReading reading : readings) {
            grouped.computeIfAbsent(reading.getEntityId(), k -> new ArrayList<>()).add(reading);
        }
        return grouped;
    }

    /**
     * @param batchLatest latest timestamp across the whole batch, the reference
     *                    point for the trailing-24h daily reporting check
     * @return empty when the entity has fewer than {@code minDataPoints} readings
     */
    public Optional<EntityStats> calculate(String entityId, List<NormalizedReading> readings,
                                           DetectionSettings settings, Instant batchLatest) {
        int n = readings.size();
        if (n == 0 || n < settings.getMinDataPoints()) {
            return Optional.empty();
        }

        double[] values = new double[n];
        Instant first = readings.get(0).getTimestamp();
        Instant last = first;
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            NormalizedReading r = readings.get(i);
            values[i] = r.getValue();
            sum += values[i];
            if (r.getTimestamp().isBefore(first)) first = r.getTimestamp();
            if (r.getTimestamp().isAfter(last)) last = r.getTimestamp();
        }
        Arrays.sort(values);

        double mean = sum / n;
        double median = (n % 2 == 0)
                ? (values[n / 2 - 1] + values[n / 2]) / 2.0
                : values[n / 2];

        double squares = 0.0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        double stdDev = Math.sqrt(squares / n);

        double q1 = values[(int) Math.floor(n * 0.25)];
        double q3 = values[(int) Math.floor(n * 0.75)];

        double days = (last.toEpochMilli() - first.toEpochMilli()) / MILLIS_PER_DAY;
        double reportingFrequency = n / Math.max(days, 1.0);

        boolean healthy = settings.isRequireDailyReporting()
                ? countSince(readings, batchLatest.minus(Duration.ofHours(24))) >= DAILY_REPORTING_MIN_READINGS
                : n >= settings.getMinDataPoints();

        return Optional.of(EntityStats.builder()
                .entityId(entityId)
                .mean(mean)
                .median(median)
                .stdDev(stdDev)
                .q1(q1)
                .q3(q3)
                .iqr(q3 - q1)
                .dataPoints(n)
                .lastReporting(last)
                .reportingFrequency(reportingFrequency)
                .healthy(healthy)
                .build());
    }

    private static long countSince(List<NormalizedReading> readings, Instant cutoff) {
        return readings.stream()
                .filter(r -> r.getTimestamp().isAfter(cutoff))
                .count();
    }
}
