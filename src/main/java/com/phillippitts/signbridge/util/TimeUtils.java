package com.phillippitts.signbridge.util;

/**
 * Conversions between the nanosecond timestamps of {@link System#nanoTime()} and the
 * millisecond/microsecond units used in latency audits.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    /**
     * Number of nanoseconds in one microsecond.
     */
    public static final double NANOS_PER_MICRO = 1_000.0;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds (truncated).
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Converts nanoseconds to fractional microseconds.
     */
    public static double nanosToMicros(long nanos) {
        return nanos / NANOS_PER_MICRO;
    }

    /**
     * Calculates elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }
}
