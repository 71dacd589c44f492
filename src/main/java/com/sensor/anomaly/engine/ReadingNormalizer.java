package com.sensor.anomaly.engine;

import com.sensor.anomaly.model.DetectionSettings;
import com.sensor.anomaly.model.NormalizedReading;
import com.sensor.anomaly.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates raw readings and coerces them to a finite numeric value.
 * Unusable readings are dropped without raising; input order is preserved.
 *
 * Value resolution order:
 * 1. {@code value} already a finite number
 * 2. {@code value} as a numeric string
 * 3. {@code state} as a numeric string
 * 4. {@code state} through the boolean-like lexicon (on/open/home/true = 1, off/closed/away/false = 0)
 */
@Component
public class ReadingNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ReadingNormalizer.class);

    // Leading decimal number, so "21.5 °C" resolves to 21.5.
    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");

    private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d+");

    public List<NormalizedReading> normalize(List<Reading> readings, DetectionSettings settings) {
        if (readings == null || readings.isEmpty()) {
            log.debug("Normalizer received an empty batch");
            return List.of();
        }

        List<NormalizedReading> kept = new ArrayList<>(readings.size());
        for (Reading reading : readings) {
            if (!isEligible(reading, settings)) continue;

            Optional<Instant> timestamp = resolveTimestamp(reading.getTimestamp());
            if (timestamp.isEmpty()) continue;

            OptionalDouble numeric = resolveValue(reading.getValue(), reading.getState());
            if (numeric.isEmpty()) continue;

            kept.add(NormalizedReading.builder()
                    .timestamp(timestamp.get())
                    .entityId(reading.getEntityId())
                    .value(numeric.getAsDouble())
                    .build());
        }

        log.debug("Normalized readings: kept={}, dropped={}", kept.size(), readings.size() - kept.size());
        return kept;
    }

    private boolean isEligible(Reading reading, DetectionSettings settings) {
        if (reading == null) return false;
        String entityId = reading.getEntityId();
        if (entityId == null || entityId.isBlank()) return false;

        String state = reading.getState();
        if (state != null && settings.getExcludeStates().contains(state.toLowerCase(Locale.ROOT))) {
            return false;
        }
        return !settings.getExcludeDomains().contains(domainOf(entityId));
    }

    static String domainOf(String entityId) {
        int dot = entityId.indexOf('.');
        return dot >= 0 ? entityId.substring(0, dot) : entityId;
    }

    /**
     * Accepts an {@link Instant}, epoch milliseconds (number or digit string) or an
     * ISO-8601 date-time with offset. Anything else resolves to empty.
     */
    static Optional<Instant> resolveTimestamp(Object raw) {
        if (raw instanceof Instant instant) return Optional.of(instant);
        if (raw instanceof Number n) {
            double millis = n.doubleValue();
            return Double.isFinite(millis) ? Optional.of(Instant.ofEpochMilli(n.longValue())) : Optional.empty();
        }
        if (!(raw instanceof String s) || s.isBlank()) {
            return Optional.empty();
        }

        String text = s.trim();
        if (EPOCH_MILLIS.matcher(text).matches()) {
            try {
                return Optional.of(Instant.ofEpochMilli(Long.parseLong(text)));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static OptionalDouble resolveValue(Object value, String state) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isFinite(d)) return OptionalDouble.of(d);
        }
        if (value instanceof String s) {
            OptionalDouble parsed = parseLeadingNumber(s);
            if (parsed.isPresent()) return parsed;
        }
        if (state == null) {
            return OptionalDouble.empty();
        }

        OptionalDouble parsedState = parseLeadingNumber(state);
        if (parsedState.isPresent()) return parsedState;

        switch (state.trim().toLowerCase(Locale.ROOT)) {
            case "on":
            case "open":
            case "home":
            case "true":
                return OptionalDouble.of(1);
            case "off":
            case "closed":
            case "away":
            case "false":
                return OptionalDouble.of(0);
            default:
                return OptionalDouble.empty();
        }
    }

    private static OptionalDouble parseLeadingNumber(String text) {
        Matcher m = LEADING_NUMBER.matcher(text);
        if (!m.lookingAt()) return OptionalDouble.empty();
        double d = Double.parseDouble(m.group(1));
        return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
    }
}
