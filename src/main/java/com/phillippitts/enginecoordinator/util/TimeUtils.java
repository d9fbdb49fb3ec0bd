package com.phillippitts.enginecoordinator.util;

import java.time.Duration;

/**
 * Time helpers for latency bookkeeping and deadline arithmetic.
 *
 * <p>Deadlines are expressed as absolute {@link System#nanoTime()} values so that wall-clock
 * adjustments never stretch or shrink a task's budget.
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
     * Absolute nanoTime deadline that lies {@code budget} from now.
     */
    public static long deadlineAfter(Duration budget) {
        return System.nanoTime() + budget.toNanos();
    }

    /**
     * Time left until an absolute nanoTime deadline; never negative.
     */
    public static Duration remaining(long deadlineNanos) {
        long left = deadlineNanos - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    /**
     * Returns the shorter of two durations. A null argument yields the other one.
     */
    public static Duration min(Duration a, Duration b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) <= 0 ? a : b;
    }
}
