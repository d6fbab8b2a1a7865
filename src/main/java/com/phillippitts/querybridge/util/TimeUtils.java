package com.phillippitts.querybridge.util;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Used with {@link System#nanoTime()} for latency measurement of worker calls and jobs.
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
     * Converts nanoseconds to milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds (truncated)
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Exponential backoff: {@code min(base * 2^(attempt-1), max)}.
     *
     * @param attempt 1-based attempt number that just failed
     * @param baseMs delay after the first failure
     * @param maxMs upper bound for any delay
     * @return delay in milliseconds, never negative
     */
    public static long exponentialBackoff(int attempt, long baseMs, long maxMs) {
        if (attempt < 1 || baseMs <= 0) {
            return 0L;
        }
        int shift = Math.min(attempt - 1, 30);
        long delay = baseMs << shift;
        if (delay < 0 || delay > maxMs) {
            return Math.max(0L, maxMs);
        }
        return delay;
    }
}
