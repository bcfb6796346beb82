package com.williamcallahan.ratchet.jobs;

import java.time.Duration;

/**
 * Retry delays for failed job attempts.
 */
public final class RetryPolicy {

    /** First retry delay of the exponential schedule. */
    public static final Duration INITIAL_BACKOFF = Duration.ofSeconds(1);
    /** Cap on the exponential schedule. */
    public static final Duration MAX_BACKOFF = Duration.ofHours(1);

    private static final int MAX_SHIFT = 30;

    private RetryPolicy() {}

    /**
     * Doubles from {@link #INITIAL_BACKOFF} per attempt, capped at {@link #MAX_BACKOFF}.
     *
     * @param attempt the attempt that just failed, starting at 1
     */
    public static Duration exponential(int attempt) {
        int shift = Math.min(Math.max(attempt, 1) - 1, MAX_SHIFT);
        Duration delay = INITIAL_BACKOFF.multipliedBy(1L << shift);
        return delay.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : delay;
    }

    /**
     * Same delay for every attempt.
     */
    public static Duration fixed(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("Retry delay must be non-negative");
        }
        return delay;
    }
}
