package com.phillippitts.speakruntime.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for elapsed time calculations.
 *
 * @since 1.0
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
     * <p>Typical usage:
     * <pre>
     * long startTime = System.nanoTime();
     * // ... run a hook ...
     * long elapsedMs = TimeUtils.elapsedMillis(startTime);
     * </pre>
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Returns true when {@code since} is null or at least {@code window} before {@code now}.
     * A null timestamp means the event never happened, so any window has elapsed.
     *
     * @param since time of the last occurrence, may be null
     * @param window required gap
     * @param now current time
     */
    public static boolean hasElapsed(Instant since, Duration window, Instant now) {
        if (since == null) {
            return true;
        }
        return !Duration.between(since, now).minus(window).isNegative();
    }
}
