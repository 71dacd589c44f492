package com.sensor.anomaly.engine;

import com.sensor.anomaly.model.Anomaly;
import com.sensor.anomaly.model.DetectionMethod;
import com.sensor.anomaly.model.DetectionResult;
import com.sensor.anomaly.model.DetectionSettings;
import com.sensor.anomaly.model.EntityStats;
import com.sensor.anomaly.model.NormalizedReading;
import com.sensor.anomaly.model.Reading;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Core detection pipeline: normalize, group, compute statistics, run every
 * registered detector per entity, then deduplicate, rank and summarize.
 * Uses the Strategy pattern: each DetectionMethod is handled by a registered AnomalyDetector.
 *
 * The engine holds no per-run state. Entities are fanned out to the detection
 * executor and fanned back in in first-appearance order, so the pooled list (and
 * therefore which duplicate survives) does not depend on thread scheduling.
 */
@Component
public class AnomalyDetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionEngine.class);

    private final ReadingNormalizer normalizer;
    private final EntityStatisticsCalculator statisticsCalculator;
    private final Map<DetectionMethod, AnomalyDetector> detectorMap;
    private final AnomalyRanker ranker;
    private final DetectionSummarizer summarizer;
    private final ExecutorService executor;

    public AnomalyDetectionEngine(ReadingNormalizer normalizer,
                                  EntityStatisticsCalculator statisticsCalculator,
                                  List<AnomalyDetector> detectors,
                                  AnomalyRanker ranker,
                                  DetectionSummarizer summarizer,
                                  @Qualifier("detectionExecutor") ExecutorService executor) {
        this.normalizer = normalizer;
        this.statisticsCalculator = statisticsCalculator;
        this.detectorMap = new EnumMap<>(DetectionMethod.class);
        this.ranker = ranker;
        this.summarizer = summarizer;
        this.executor = executor;

        // Auto-register all detector implementations
        for (AnomalyDetector detector : detectors) {
            detectorMap.put(detector.getSupportedMethod(), detector);
            log.info("Registered anomaly detector: {} -> {}",
                    detector.getSupportedMethod(), detector.getClass().getSimpleName());
        }
        for (DetectionMethod method : DetectionMethod.values()) {
            if (!detectorMap.containsKey(method)) {
                log.warn("No detector registered for detection method: {}", method);
            }
        }
    }

    /**
     * Run the full pipeline over one batch.
     *
     * @param readings raw readings in any order; may be null or empty
     * @param settings the configuration snapshot for this run
     * @return ranked anomalies, statistics for every analyzed entity, and a summary;
     *         never null, empty structures when nothing usable was supplied
     */
    public DetectionResult detect(List<Reading> readings, DetectionSettings settings) {
        List<NormalizedReading> normalized = normalizer.normalize(readings, settings);
        if (normalized.isEmpty()) {
            log.warn("No valid readings found for anomaly detection ({} received)",
                    readings == null ? 0 : readings.size());
            return DetectionResult.empty();
        }

        Map<String, List<NormalizedReading>> byEntity = statisticsCalculator.groupByEntity(normalized);
        Instant batchLatest = normalized.stream()
                .map(NormalizedReading::getTimestamp)
                .max(Instant::compareTo)
                .orElseThrow();
        log.debug("Analyzing {} entities from {} valid readings", byEntity.size(), normalized.size());

        List<String> entityIds = new ArrayList<>(byEntity.keySet());
        List<Future<EntityOutcome>> futures = new ArrayList<>(entityIds.size());
        for (String entityId : entityIds) {
            List<NormalizedReading> entityReadings = List.copyOf(byEntity.get(entityId));
            futures.add(executor.submit(() -> analyzeEntity(entityId, entityReadings, settings, batchLatest)));
        }

        List<EntityStats> entityStats = new ArrayList<>();
        List<Anomaly> pooled = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            EntityOutcome outcome = await(entityIds.get(i), futures.get(i));
            outcome.getStats().ifPresent(entityStats::add);
            pooled.addAll(outcome.getAnomalies());
        }

        List<Anomaly> ranked = ranker.deduplicateAndRank(pooled);
        DetectionResult result = DetectionResult.builder()
                .anomalies(ranked)
                .entityStats(entityStats)
                .summary(summarizer.summarize(entityStats, ranked))
                .build();

        log.info("Anomaly detection complete: {} anomalies ({} before dedup) across {} entities",
                ranked.size(), pooled.size(), entityStats.size());
        return result;
    }

    EntityOutcome analyzeEntity(String entityId, List<NormalizedReading> readings,
                                DetectionSettings settings, Instant batchLatest) {
        try {
            Optional<EntityStats> maybeStats =
                    statisticsCalculator.calculate(entityId, readings, settings, batchLatest);
            if (maybeStats.isEmpty()) {
                log.debug("Skipping {}: insufficient data ({} points, min {})",
                        entityId, readings.size(), settings.getMinDataPoints());
                return EntityOutcome.skipped();
            }

            EntityStats stats = maybeStats.get();
            if (settings.isRequireDailyReporting() && !stats.isHealthy()) {
                log.warn("Skipping detection for {}: not reporting daily", entityId);
                return new EntityOutcome(maybeStats, List.of());
            }

            if (log.isDebugEnabled()) {
                log.debug("Analyzing {}: {} points, mean={}, stdDev={}",
                        entityId, stats.getDataPoints(),
                        String.format("%.2f", stats.getMean()),
                        String.format("%.2f", stats.getStdDev()));
            }

            List<Anomaly> anomalies = new ArrayList<>();
            for (DetectionMethod method : DetectionMethod.values()) {
                AnomalyDetector detector = detectorMap.get(method);
                if (detector != null) {
                    anomalies.addAll(detector.detect(readings, stats, settings));
                }
            }
            return new EntityOutcome(maybeStats, anomalies);
        } catch (RuntimeException e) {
            // One bad entity must not block the rest of the batch
            log.error("Error analyzing entity {}: {}", entityId, e.getMessage(), e);
            return EntityOutcome.skipped();
        }
    }

    private EntityOutcome await(String entityId, Future<EntityOutcome> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Error analyzing entity {}: {}", entityId, e.getCause().getMessage(), e.getCause());
            return EntityOutcome.skipped();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Anomaly detection interrupted while waiting for " + entityId, e);
        }
    }

    @Value
    static class EntityOutcome {
        Optional<EntityStats> stats;
        List<Anomaly> anomalies;

        static EntityOutcome skipped() {
            return new EntityOutcome(Optional.empty(), List.of());
        }
    }
}
