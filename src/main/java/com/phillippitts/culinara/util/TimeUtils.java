package com.phillippitts.culinara.util;

/**
 * Utility methods for elapsed-time and deadline arithmetic based on {@link System#nanoTime()}.
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
     * Milliseconds left before a budget that started at {@code startNanos} runs out.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @param budgetMs   total budget in milliseconds
     * @return remaining milliseconds, never negative
     */
    public static long remainingMillis(long startNanos, long budgetMs) {
        return Math.max(0L, budgetMs - elapsedMillis(startNanos));
    }
}
