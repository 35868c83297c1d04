package com.phillippitts.multishot.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldCalculateElapsedMillis() {
        long startNanos = System.nanoTime();

        try {
            Thread.sleep(10);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        long elapsedMs = TimeUtils.elapsedMillis(startNanos);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(5L);
        // Generous upper bound to avoid flaky tests
        assertThat(elapsedMs).isLessThan(1000L);
    }

    @Test
    void shouldNeverReportNegativeElapsedTime() {
        long future = System.nanoTime() + 10 * TimeUtils.NANOS_PER_MILLI * 1000;

        assertThat(TimeUtils.elapsedMillis(future)).isZero();
    }

    @Test
    void shouldFormatMillisecondsBelowOneSecond() {
        assertThat(TimeUtils.formatDuration(0)).isEqualTo("0ms");
        assertThat(TimeUtils.formatDuration(850)).isEqualTo("850ms");
    }

    @Test
    void shouldFormatSecondsWithOneDecimal() {
        assertThat(TimeUtils.formatDuration(2400)).isEqualTo("2.4s");
        assertThat(TimeUtils.formatDuration(59_000)).isEqualTo("59.0s");
    }

    @Test
    void shouldFormatMinutesWithPaddedSeconds() {
        assertThat(TimeUtils.formatDuration(65_000)).isEqualTo("1m 05s");
        assertThat(TimeUtils.formatDuration(600_000)).isEqualTo("10m 00s");
    }
}
