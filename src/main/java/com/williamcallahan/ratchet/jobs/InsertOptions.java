package com.williamcallahan.ratchet.jobs;

import java.time.Instant;

/**
 * Per-insert queue options.
 *
 * @param priority claim priority, see {@link JobPriority}
 * @param scheduledAt earliest run time, null for immediately
 * @param uniqueKey when set, at most one not-yet-running job of the same kind may hold this key;
 *     later inserts with the same key are dropped
 */
public record InsertOptions(int priority, Instant scheduledAt, String uniqueKey) {

    public InsertOptions {
        JobPriority.validate(priority);
    }

    public static InsertOptions defaults() {
        return new InsertOptions(JobPriority.LIVE, null, null);
    }

    public static InsertOptions backfill() {
        return new InsertOptions(JobPriority.BACKFILL, null, null);
    }

    public InsertOptions withPriority(int newPriority) {
        return new InsertOptions(newPriority, scheduledAt, uniqueKey);
    }

    public InsertOptions scheduledAt(Instant runAt) {
        return new InsertOptions(priority, runAt, uniqueKey);
    }

    public InsertOptions uniqueBy(String key) {
        return new InsertOptions(priority, scheduledAt, key);
    }
}
