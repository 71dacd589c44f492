package com.sensor.anomaly.engine;

import com.sensor.anomaly.model.Anomaly;
import com.sensor.anomaly.model.DetectionSummary;
import com.sensor.anomaly.model.EntityStats;
import com.sensor.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class DetectionSummarizer {

    public DetectionSummary summarize(List<EntityStats> entityStats, List<Anomaly> anomalies) {
        Map<String, Long> byMethod = new LinkedHashMap<>();
        Map<String, Long> byEntity = new LinkedHashMap<>();
        int critical = 0, high = 0, medium = 0, low = 0;

        for (Anomaly anomaly : anomalies) {
            byMethod.merge(anomaly.getMethod().getLabel(), 1L, Long::sum);
            byEntity.merge(anomaly.getEntityId(), 1L, Long::sum);
            Severity severity = anomaly.getSeverity();
            switch (severity) {
                case CRITICAL -> critical++;
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
        }

        return DetectionSummary.builder()
                .totalEntities(entityStats.size())
                .healthyEntities((int) entityStats.stream().filter(EntityStats::isHealthy).count())
                .totalAnomalies(anomalies.size())
                .criticalAnomalies(critical)
                .highSeverityAnomalies(high)
                .mediumSeverityAnomalies(medium)
                .lowSeverityAnomalies(low)
                .detectionMethods(byMethod)
                .anomaliesByEntity(byEntity)
                .build();
    }
}
