package com.sensor.anomaly.engine;

import com.sensor.anomaly.model.Anomaly;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges pooled findings from all methods and entities.
 *
 * Deduplication key is (entity, type, clock hour of the timestamp); the first
 * finding encountered for a key wins, whichever method produced it. Survivors
 * are ordered by severity descending, then timestamp descending.
 */
@Component
public class AnomalyRanker {

    private static final long MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    static final Comparator<Anomaly> RANKING = Comparator
            .comparing(Anomaly::getSeverity, Comparator.reverseOrder())
            .thenComparing(Anomaly::getTimestamp, Comparator.reverseOrder());

    public List<Anomaly> deduplicateAndRank(List<Anomaly> pooled) {
        Set<String> seen = new HashSet<>();
        List<Anomaly> unique = new ArrayList<>();
        for (Anomaly anomaly : pooled) {
            if (seen.add(dedupKey(anomaly))) {
                unique.add(anomaly);
            }
        }
        unique.sort(RANKING);
        return unique;
    }

    static String dedupKey(Anomaly anomaly) {
        long hourBucket = Math.floorDiv(anomaly.getTimestamp().toEpochMilli(), MILLIS_PER_HOUR);
        return anomaly.getEntityId() + "|" + anomaly.getType() + "|" + hourBucket;
    }
}
