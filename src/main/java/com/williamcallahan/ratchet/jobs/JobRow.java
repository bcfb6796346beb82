package com.williamcallahan.ratchet.jobs;

import java.time.Instant;

/**
 * Persisted job as read back from the queue table.
 *
 * @param argsJson payload JSON, decoded by the runner using the worker's declared args type
 * @param uniqueSpec the unique key requested at insert time, kept after the live key is released
 */
public record JobRow(
        long id,
        String kind,
        String argsJson,
        JobState state,
        int priority,
        int attempt,
        int maxAttempts,
        Instant scheduledAt,
        Instant attemptedAt,
        String uniqueSpec,
        String lastError) {

    public boolean attemptsExhausted() {
        return attempt >= maxAttempts;
    }
}
