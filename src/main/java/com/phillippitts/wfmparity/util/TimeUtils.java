package com.phillippitts.wfmparity.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Time helpers for execution timing and trailing windows.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a {@link System#nanoTime()} reading.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Start of a trailing window ending at {@code now}.
     */
    public static Instant windowStart(Instant now, Duration window) {
        return now.minus(window);
    }

    public static Instant daysBefore(Instant now, int days) {
        return now.minus(Duration.ofDays(days));
    }
}
