package com.phillippitts.multishot.util;

import java.util.Locale;

/**
 * Utility methods for elapsed time calculations and duration rendering.
 *
 * <p>Timing uses {@link System#nanoTime()}; wall-clock timestamps come from {@code Instant.now()}.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * <pre>
     * long startTime = System.nanoTime();
     * // ... call the backend ...
     * long elapsedMs = TimeUtils.elapsedMillis(startTime);
     * </pre>
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos, never negative
     */
    public static long elapsedMillis(long startNanos) {
        return Math.max(0, (System.nanoTime() - startNanos) / NANOS_PER_MILLI);
    }

    /**
     * Renders a duration for reports: {@code 850ms}, {@code 2.4s}, {@code 1m 05s}.
     */
    public static String formatDuration(long millis) {
        if (millis < 1000) {
            return millis + "ms";
        }
        if (millis < 60_000) {
            return String.format(Locale.ROOT, "%.1fs", millis / 1000.0);
        }
        long seconds = millis / 1000;
        return String.format(Locale.ROOT, "%dm %02ds", seconds / 60, seconds % 60);
    }
}
