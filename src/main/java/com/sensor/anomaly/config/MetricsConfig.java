package com.sensor.anomaly.config;

import com.sensor.anomaly.model.Anomaly;
import com.sensor.anomaly.model.DetectionResult;
import com.sensor.anomaly.model.EntityStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger unhealthyEntityCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.unhealthyEntityCount = registry.gauge("detection.entities.unhealthy", new AtomicInteger(0));
    }

    public void recordDetectionRun(int readingCount, DetectionResult result) {
        Counter.builder("detection.run.count")
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.batch.readings")
                .register(registry)
                .record(readingCount);

        for (Anomaly anomaly : result.getAnomalies()) {
            recordAnomaly(anomaly.getMethod().getLabel(), anomaly.getSeverity().getLabel());
        }

        int unhealthy = (int) result.getEntityStats().stream()
                .filter(stats -> !stats.isHealthy())
                .count();
        unhealthyEntityCount.set(unhealthy);
    }

    public void recordAnomaly(String method, String severity) {
        Counter.builder("detection.anomaly.count")
                .tag("method", method)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordConfigUpdate() {
        Counter.builder("detection.config.updates")
                .register(registry)
                .increment();
    }
}
