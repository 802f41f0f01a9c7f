package com.lyshra.open.flowsync.core.engine.sync;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Brings runtime last-modified timestamps to one representation (UTC instant, millisecond
 * precision) so that {@code 2024-05-01T10:00:00.000Z}, {@code 2024-05-01T12:00:00+02:00}
 * and {@code 2024-05-01T10:00:00.000123} compare equal.
 *
 * <p>Values without a zone are read as UTC. Anything unparseable yields empty, which makes
 * the caller recompute instead of skipping.</p>
 */
@Slf4j
public final class TimestampNormalizer {

    private static final Pattern EPOCH_MILLIS = Pattern.compile("\\d{1,15}");

    private TimestampNormalizer() {
    }

    public static Optional<Instant> normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (EPOCH_MILLIS.matcher(value).matches()) {
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(value)));
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value, OffsetDateTime::from, LocalDateTime::from);
            Instant instant = parsed instanceof OffsetDateTime
                    ? ((OffsetDateTime) parsed).toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
            return Optional.of(truncate(instant));
        } catch (DateTimeParseException e) {
            log.debug("Unparseable runtime timestamp '{}': {}", raw, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * True only when both sides are known and denote the same millisecond.
     */
    public static boolean isUnchanged(Instant stored, String raw) {
        if (stored == null) {
            return false;
        }
        return normalize(raw)
                .map(observed -> observed.equals(truncate(stored)))
                .orElse(false);
    }

    private static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MILLIS);
    }
}
