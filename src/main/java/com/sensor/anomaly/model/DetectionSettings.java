package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable configuration snapshot a single detection run works against.
 * Taken once at entry, so later config updates never affect a run in flight.
 */
@Value
@Builder(toBuilder = true)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@Schema(description = "Effective detection configuration")
public class DetectionSettings {

    @Schema(example = "2.5")
    double zScoreThreshold;

    @Schema(example = "1.5")
    double iqrMultiplier;

    @Schema(example = "5")
    int minDataPoints;

    @Schema(description = "Lower-cased states treated as invalid")
    Set<String> excludeStates;

    @Schema(description = "Entity domains excluded entirely")
    Set<String> excludeDomains;

    @Schema(example = "false")
    boolean requireDailyReporting;

    public static DetectionSettings of(double zScoreThreshold, double iqrMultiplier, int minDataPoints,
                                       Set<String> excludeStates, Set<String> excludeDomains,
                                       boolean requireDailyReporting) {
        return DetectionSettings.builder()
                .zScoreThreshold(zScoreThreshold)
                .iqrMultiplier(iqrMultiplier)
                .minDataPoints(minDataPoints)
                .excludeStates(lowerCased(excludeStates))
                .excludeDomains(frozen(excludeDomains))
                .requireDailyReporting(requireDailyReporting)
                .build();
    }

    /**
     * Returns a new snapshot with the non-null fields of {@code update} applied.
     *
     * @throws com.sensor.anomaly.config.InvalidDetectionConfigException if any supplied value is invalid
     */
    public DetectionSettings applying(DetectionConfigUpdate update) {
        if (update == null) {
            return this;
        }
        update.validate();
        return of(
                update.getZScoreThreshold() != null ? update.getZScoreThreshold() : zScoreThreshold,
                update.getIqrMultiplier() != null ? update.getIqrMultiplier() : iqrMultiplier,
                update.getMinDataPoints() != null ? update.getMinDataPoints() : minDataPoints,
                update.getExcludeStates() != null ? update.getExcludeStates() : excludeStates,
                update.getExcludeDomains() != null ? update.getExcludeDomains() : excludeDomains,
                update.getRequireDailyReporting() != null ? update.getRequireDailyReporting() : requireDailyReporting);
    }

    private static Set<String> lowerCased(Set<String> states) {
        if (states == null) return Collections.emptySet();
        return Collections.unmodifiableSet(states.stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.<String, Set<String>>toCollection(LinkedHashSet::new)));
    }

    private static Set<String> frozen(Set<String> values) {
        if (values == null) return Collections.emptySet();
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
