package com.phillippitts.windpressure.util;

import java.time.Duration;

/**
 * Elapsed-time helpers for run timing and status text.
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
     * Calculates elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds (truncated)
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Elapsed time since a {@link System#nanoTime()} timestamp as a {@link Duration}.
     */
    public static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Formats a duration as {@code H:MM:SS.ffffff} (microsecond precision), e.g.
     * {@code 0:00:02.503117}. Negative durations are clamped to zero.
     *
     * @param elapsed duration to format
     * @return formatted duration
     */
    public static String formatElapsed(Duration elapsed) {
        Duration d = elapsed.isNegative() ? Duration.ZERO : elapsed;
        long hours = d.toHours();
        int minutes = d.toMinutesPart();
        int seconds = d.toSecondsPart();
        long micros = d.toNanosPart() / 1_000L;
        return String.format("%d:%02d:%02d.%06d", hours, minutes, seconds, micros);
    }
}
