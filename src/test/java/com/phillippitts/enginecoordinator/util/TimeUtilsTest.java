package com.phillippitts.enginecoordinator.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldConvertNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_000_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(100_000_000L)).isEqualTo(100L);
    }

    @Test
    void shouldTruncateNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_500_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
    }

    @Test
    void shouldCalculateElapsedMillisFromPastTimestamp() {
        long startNanos = System.nanoTime() - (1_000L * TimeUtils.NANOS_PER_MILLI);

        long elapsedMs = TimeUtils.elapsedMillis(startNanos);

        assertThat(elapsedMs).isBetween(1_000L, 1_100L);
    }

    @Test
    void shouldReportRemainingBudget() {
        long deadline = TimeUtils.deadlineAfter(Duration.ofSeconds(10));

        assertThat(TimeUtils.remaining(deadline)).isBetween(Duration.ofSeconds(9), Duration.ofSeconds(10));
    }

    @Test
    void shouldNeverReportNegativeRemaining() {
        long deadline = System.nanoTime() - 5_000_000L;

        assertThat(TimeUtils.remaining(deadline)).isEqualTo(Duration.ZERO);
    }

    @Test
    void shouldPickShorterDuration() {
        assertThat(TimeUtils.min(Duration.ofMillis(200), Duration.ofSeconds(60))).isEqualTo(Duration.ofMillis(200));
        assertThat(TimeUtils.min(null, Duration.ofSeconds(60))).isEqualTo(Duration.ofSeconds(60));
        assertThat(TimeUtils.min(Duration.ofSeconds(1), null)).isEqualTo(Duration.ofSeconds(1));
    }
}
