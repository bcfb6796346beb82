package com.williamcallahan.ratchet.jobs;

import java.time.Duration;

/**
 * Executes jobs of a single kind.
 *
 * <p>A body that returns normally completes the job. Any exception fails the attempt; the job is
 * retried at {@link #nextRetry(int)} until its attempt budget is exhausted. Bodies must be idempotent
 * because an attempt can fail after some of its effects were committed.</p>
 *
 * @param <A> payload type
 */
public interface JobWorker<A extends JobArgs> {

    String kind();

    Class<A> argsType();

    void work(JobContext context, A args);

    /**
     * Upper bound on a single attempt.
     */
    default Duration timeout() {
        return Duration.ofMinutes(1);
    }

    /**
     * Delay before the next attempt after {@code attempt} failed.
     */
    default Duration nextRetry(int attempt) {
        return RetryPolicy.exponential(attempt);
    }
}
