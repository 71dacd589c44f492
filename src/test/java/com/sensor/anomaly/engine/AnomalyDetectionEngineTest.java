package com.sensor.anomaly.engine;

import com.sensor.anomaly.engine.detectors.IqrDetector;
import com.sensor.anomaly.engine.detectors.MissingDataDetector;
import com.sensor.anomaly.engine.detectors.StuckValueDetector;
import com.sensor.anomaly.engine.detectors.ZScoreDetector;
import com.sensor.anomaly.model.Anomaly;
import com.sensor.anomaly.model.AnomalyType;
import com.sensor.anomaly.model.DetectionMethod;
import com.sensor.anomaly.model.DetectionResult;
import com.sensor.anomaly.model.DetectionSettings;
import com.sensor.anomaly.model.EntityStats;
import com.sensor.anomaly.model.NormalizedReading;
import com.sensor.anomaly.model.Reading;
import com.sensor.anomaly.model.Severity;
import com.sensor.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.sensor.anomaly.testutil.TestDataFactory.BASE_TIME;
import static com.sensor.anomaly.testutil.TestDataFactory.alternating;
import static com.sensor.anomaly.testutil.TestDataFactory.createReading;
import static com.sensor.anomaly.testutil.TestDataFactory.readingSeries;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;

class AnomalyDetectionEngineTest {

    private final DetectionSettings settings = TestDataFactory.defaultSettings();
    private ExecutorService executor;
    private AnomalyDetectionEngine engine;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        engine = engineWith(executor, defaultDetectors());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static List<AnomalyDetector> defaultDetectors() {
        return List.of(new ZScoreDetector(), new IqrDetector(), new MissingDataDetector(), new StuckValueDetector());
    }

    private static AnomalyDetectionEngine engineWith(ExecutorService executor, List<AnomalyDetector> detectors) {
        return new AnomalyDetectionEngine(new ReadingNormalizer(), new EntityStatisticsCalculator(),
                detectors, new AnomalyRanker(), new DetectionSummarizer(), executor);
    }

    private static double[] concat(double[] head, double... tail) {
        double[] values = Arrays.copyOf(head, head.length + tail.length);
        System.arraycopy(tail, 0, values, head.length, tail.length);
        return values;
    }

    /** 20 readings alternating 21/19 followed by a single 35. */
    private static List<Reading> spikeSeries(String entityId) {
        return readingSeries(entityId, Duration.ofMinutes(10), concat(alternating(20, 1, 20), 35));
    }

    // --- Degenerate input ---

    @Test
    void detect_nullOrEmptyBatch_emptyResult() {
        assertThat(engine.detect(null, settings)).isEqualTo(DetectionResult.empty());
        assertThat(engine.detect(List.of(), settings)).isEqualTo(DetectionResult.empty());
    }

    @Test
    void detect_allReadingsInvalid_emptyResult() {
        List<Reading> readings = List.of(
                createReading("sensor.a", BASE_TIME, null, "unavailable"),
                createReading("automation.lights", BASE_TIME, 1.0, "1"),
                createReading("sensor.b", null, 1.0, "1"),
                createReading("sensor.c", BASE_TIME, "abc", "idle"));

        DetectionResult result = engine.detect(readings, settings);

        assertThat(result.getAnomalies()).isEmpty();
        assertThat(result.getEntityStats()).isEmpty();
        assertThat(result.getSummary().getTotalEntities()).isZero();
    }

    @Test
    void detect_entityBelowMinDataPoints_noStatsNoAnomalies() {
        List<Reading> readings = new ArrayList<>(readingSeries("sensor.short", Duration.ofMinutes(10), 1, 2, 100));
        readings.addAll(readingSeries("sensor.ok", Duration.ofMinutes(10), 1, 2, 3, 2, 1));

        DetectionResult result = engine.detect(readings, settings);

        assertThat(result.getEntityStats()).extracting(EntityStats::getEntityId).containsExactly("sensor.ok");
        assertThat(result.getAnomalies()).isEmpty();
    }

    @Test
    void detect_excludedDomain_neverAnalyzed() {
        List<Reading> readings = new ArrayList<>(spikeSeries("automation.morning"));
        readings.addAll(readingSeries("sensor.ok", Duration.ofMinutes(10), 1, 2, 3, 2, 1));

        DetectionResult result = engine.detect(readings, settings);

        assertThat(result.getEntityStats()).extracting(EntityStats::getEntityId).containsExactly("sensor.ok");
        assertThat(result.getAnomalies()).isEmpty();
    }

    // --- End-to-end scenarios ---

    @Test
    void detect_spikeFoundByZScoreAndIqr_reportedOnceByZScore() {
        DetectionResult result = engine.detect(spikeSeries("sensor.living_room_temperature"), settings);

        assertThat(result.getAnomalies()).hasSize(1);
        Anomaly spike = result.getAnomalies().get(0);
        assertThat(spike.getMethod()).isEqualTo(DetectionMethod.Z_SCORE);
        assertThat(spike.getType()).isEqualTo(AnomalyType.SPIKE);
        assertThat(spike.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(spike.getValue()).isEqualTo(35.0);
        assertThat(spike.getConfidence()).isEqualTo(1.0);
        assertThat(spike.getTimestamp()).isEqualTo(BASE_TIME.plus(Duration.ofMinutes(200)));
        assertThat(spike.getDescription()).startsWith("living room temperature spiked to 35.00");

        assertThat(result.getEntityStats()).singleElement().satisfies(stats -> {
            assertThat(stats.getDataPoints()).isEqualTo(21);
            assertThat(stats.getIqr()).isEqualTo(2.0);
            assertThat(stats.isHealthy()).isTrue();
        });
        assertThat(result.getSummary().getCriticalAnomalies()).isEqualTo(1);
        assertThat(result.getSummary().getDetectionMethods()).containsOnly(entry("z-score", 1L));
    }

    @Test
    void detect_stuckSensorWithFinalStep_stuckAndSpikeRanked() {
        double[] values = new double[13];
        Arrays.fill(values, 0, 12, 22.0);
        values[12] = 23.5;

        DetectionResult result = engine.detect(readingSeries("sensor.thermostat", Duration.ofMinutes(10), values),
                settings);

        assertThat(result.getAnomalies()).extracting(Anomaly::getType)
                .containsExactly(AnomalyType.SPIKE, AnomalyType.STUCK);
        Anomaly spike = result.getAnomalies().get(0);
        assertThat(spike.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(spike.getMethod()).isEqualTo(DetectionMethod.Z_SCORE);

        Anomaly stuck = result.getAnomalies().get(1);
        assertThat(stuck.getSeverity()).isEqualTo(Severity.LOW);
        assertThat(stuck.getTimestamp()).isEqualTo(BASE_TIME);
        assertThat(stuck.getConfidence()).isEqualTo(0.6);
        assertThat(stuck.getDescription()).isEqualTo("Sensor stuck at value 22 for 1.8 hours (12 readings)");
    }

    @Test
    void detect_reportingGap_singleMissingDataFinding() {
        List<Reading> readings = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            readings.add(createReading("sensor.power", BASE_TIME.plus(Duration.ofMinutes(10L * i)), i % 3));
        }
        Instant resume = BASE_TIME.plus(Duration.ofMinutes(290)).plus(Duration.ofHours(5));
        for (int i = 0; i < 30; i++) {
            readings.add(createReading("sensor.power", resume.plus(Duration.ofMinutes(10L * i)), i % 3));
        }

        DetectionResult result = engine.detect(readings, settings);

        assertThat(result.getAnomalies()).singleElement().satisfies(gap -> {
            assertThat(gap.getType()).isEqualTo(AnomalyType.MISSING);
            assertThat(gap.getSeverity()).isEqualTo(Severity.LOW);
            assertThat(gap.getTimestamp()).isEqualTo(BASE_TIME.plus(Duration.ofMinutes(290)));
            assertThat(gap.getDeviation()).isEqualTo(5.0);
        });
    }

    @Test
    void detect_booleanStates_mappedThroughLexicon() {
        List<Reading> readings = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            readings.add(createReading("binary_sensor.front_door", BASE_TIME.plus(Duration.ofMinutes(10L * i)),
                    null, "closed"));
        }

        DetectionResult result = engine.detect(readings, settings);

        assertThat(result.getEntityStats()).singleElement()
                .satisfies(stats -> assertThat(stats.getMean()).isEqualTo(0.0));
        assertThat(result.getAnomalies()).singleElement()
                .satisfies(stuck -> {
                    assertThat(stuck.getType()).isEqualTo(AnomalyType.STUCK);
                    assertThat(stuck.getValue()).isEqualTo(0.0);
                });
    }

    @Test
    void detect_multipleEntities_statsInFirstAppearanceOrder() {
        List<Reading> readings = new ArrayList<>();
        List<Reading> a = readingSeries("sensor.a", Duration.ofMinutes(10), alternating(5, 1, 6));
        List<Reading> b = readingSeries("sensor.b", Duration.ofMinutes(10), alternating(50, 2, 6));
        for (int i = 0; i < 6; i++) {
            readings.add(b.get(i));
            readings.add(a.get(i));
        }

        DetectionResult result = engine.detect(readings, settings);

        assertThat(result.getEntityStats()).extracting(EntityStats::getEntityId)
                .containsExactly("sensor.b", "sensor.a");
        assertThat(result.getSummary().getTotalEntities()).isEqualTo(2);
    }

    // --- Output invariants ---

    @Test
    void detect_sameInputTwice_identicalResults() {
        List<Reading> readings = mixedFleet(10, new Random(3));

        assertThat(engine.detect(readings, settings)).isEqualTo(engine.detect(readings, settings));
    }

    @Test
    void detect_anyBatch_confidenceBoundedAndDedupKeysDistinct() {
        DetectionResult result = engine.detect(mixedFleet(20, new Random(11)), settings);

        assertThat(result.getAnomalies()).isNotEmpty();
        assertThat(result.getAnomalies()).allSatisfy(anomaly -> {
            assertThat(anomaly.getConfidence()).isBetween(0.0, 1.0);
            assertThat(anomaly.getDeviation()).isGreaterThanOrEqualTo(0.0);
        });
        Set<String> keys = new HashSet<>();
        for (Anomaly anomaly : result.getAnomalies()) {
            assertThat(keys.add(AnomalyRanker.dedupKey(anomaly))).isTrue();
        }
        assertThat(result.getAnomalies()).isSortedAccordingTo(AnomalyRanker.RANKING);
        assertThat(result.getSummary().getTotalAnomalies()).isEqualTo(result.getAnomalies().size());
    }

    @Test
    void detect_parallelAndSingleThreaded_sameResult() {
        List<Reading> readings = mixedFleet(50, new Random(7));
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            DetectionResult serial = engineWith(single, defaultDetectors()).detect(readings, settings);
            DetectionResult parallel = engine.detect(readings, settings);

            assertThat(parallel).isEqualTo(serial);
        } finally {
            single.shutdownNow();
        }
    }

    // --- Failure isolation and health ---

    @Test
    void detect_detectorThrowsForOneEntity_otherEntitiesStillAnalyzed() {
        StuckValueDetector stuck = new StuckValueDetector();
        AnomalyDetector flaky = new AnomalyDetector() {
            @Override
            public DetectionMethod getSupportedMethod() {
                return DetectionMethod.PATTERN;
            }

            @Override
            public List<Anomaly> detect(List<NormalizedReading> readings, EntityStats stats, DetectionSettings s) {
                if (stats.getEntityId().equals("sensor.bad")) {
                    throw new IllegalStateException("boom");
                }
                return stuck.detect(readings, stats, s);
            }
        };
        AnomalyDetectionEngine flakyEngine = engineWith(executor,
                List.of(new ZScoreDetector(), new IqrDetector(), new MissingDataDetector(), flaky));

        List<Reading> readings = new ArrayList<>(spikeSeries("sensor.bad"));
        readings.addAll(spikeSeries("sensor.good"));

        DetectionResult result = flakyEngine.detect(readings, settings);

        assertThat(result.getEntityStats()).extracting(EntityStats::getEntityId).containsExactly("sensor.good");
        assertThat(result.getAnomalies()).extracting(Anomaly::getEntityId).containsOnly("sensor.good");
    }

    @Test
    void detect_requireDailyReporting_staleEntityKeepsStatsButIsNotAnalyzed() {
        List<Reading> readings = new ArrayList<>(spikeSeries("sensor.stale"));
        Instant freshStart = BASE_TIME.plus(Duration.ofDays(2));
        double[] freshValues = alternating(20, 1, 10);
        for (int i = 0; i < freshValues.length; i++) {
            readings.add(createReading("sensor.fresh", freshStart.plus(Duration.ofMinutes(10L * i)), freshValues[i]));
        }
        DetectionSettings daily = settings.toBuilder().requireDailyReporting(true).build();

        DetectionResult result = engine.detect(readings, daily);

        assertThat(result.getAnomalies()).isEmpty();
        assertThat(result.getEntityStats()).extracting(EntityStats::getEntityId, EntityStats::isHealthy)
                .containsExactly(
                        tuple("sensor.stale", false),
                        tuple("sensor.fresh", true));
        assertThat(result.getSummary().getHealthyEntities()).isEqualTo(1);

        // Without the requirement the stale spike is reported.
        assertThat(engine.detect(readings, settings).getAnomalies())
                .extracting(Anomaly::getEntityId).containsExactly("sensor.stale");
    }

    /**
     * Interleaved readings for {@code entities} sensors: noisy values with an
     * occasional spike, stuck run or reporting gap.
     */
    private static List<Reading> mixedFleet(int entities, Random random) {
        List<Reading> readings = new ArrayList<>();
        for (int e = 0; e < entities; e++) {
            String entityId = "sensor.unit_" + e;
            Instant t = BASE_TIME;
            for (int i = 0; i < 40; i++) {
                double value = Math.round((20 + random.nextGaussian()) * 100) / 100.0;
                if (e % 3 == 0 && i == 25) value = 60;
                if (e % 4 == 1 && i >= 10 && i < 22) value = 18.5;
                readings.add(createReading(entityId, t, value));
                t = t.plus(e % 5 == 2 && i == 30 ? Duration.ofHours(8) : Duration.ofMinutes(10));
            }
        }
        Collections.shuffle(readings, random);
        return readings;
    }
}
