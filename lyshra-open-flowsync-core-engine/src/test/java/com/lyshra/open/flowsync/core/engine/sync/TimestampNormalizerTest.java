package com.lyshra.open.flowsync.core.engine.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TimestampNormalizerTest {

    private static final Instant TEN_UTC = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    @DisplayName("should bring offsets, precision and zone-less values to one UTC instant")
    void shouldNormalizeRepresentations() {
        assertEquals(Optional.of(TEN_UTC), TimestampNormalizer.normalize("2024-05-01T10:00:00.000Z"));
        assertEquals(Optional.of(TEN_UTC), TimestampNormalizer.normalize("2024-05-01T12:00:00+02:00"));
        assertEquals(Optional.of(TEN_UTC), TimestampNormalizer.normalize("2024-05-01T10:00:00.000123"));
        assertEquals(Optional.of(TEN_UTC), TimestampNormalizer.normalize(String.valueOf(TEN_UTC.toEpochMilli())));
    }

    @Test
    @DisplayName("should yield empty for blank or unparseable values")
    void shouldRejectGarbage() {
        assertTrue(TimestampNormalizer.normalize(null).isEmpty());
        assertTrue(TimestampNormalizer.normalize("  ").isEmpty());
        assertTrue(TimestampNormalizer.normalize("yesterday").isEmpty());
    }

    @Test
    @DisplayName("should report unchanged only when both sides are known and equal")
    void shouldCompare() {
        assertTrue(TimestampNormalizer.isUnchanged(TEN_UTC, "2024-05-01T10:00:00Z"));
        assertFalse(TimestampNormalizer.isUnchanged(TEN_UTC, "2024-05-01T10:00:01Z"));
        assertFalse(TimestampNormalizer.isUnchanged(null, "2024-05-01T10:00:00Z"));
        assertFalse(TimestampNormalizer.isUnchanged(TEN_UTC, null));
        assertFalse(TimestampNormalizer.isUnchanged(TEN_UTC, "garbage"));
    }
}
