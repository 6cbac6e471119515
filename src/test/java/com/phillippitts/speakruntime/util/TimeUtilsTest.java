package com.phillippitts.speakruntime.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:30Z");

    @Test
    void elapsedMillisShouldBeNonNegative() {
        long start = System.nanoTime();
        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(0L);
    }

    @Test
    void nullTimestampAlwaysElapsed() {
        assertThat(TimeUtils.hasElapsed(null, Duration.ofDays(1), NOW)).isTrue();
    }

    @Test
    void windowBoundaryIsInclusive() {
        Instant since = NOW.minusSeconds(30);

        assertThat(TimeUtils.hasElapsed(since, Duration.ofSeconds(30), NOW)).isTrue();
        assertThat(TimeUtils.hasElapsed(since, Duration.ofSeconds(31), NOW)).isFalse();
    }
}
