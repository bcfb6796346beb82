package com.williamcallahan.ratchet.jobs;

/**
 * Queue priorities. Lower values are claimed first.
 */
public final class JobPriority {
    /** Live traffic and steady-state polling. */
    public static final int LIVE = 1;
    /** History replay; never blocks live work of the same kind. */
    public static final int BACKFILL = 4;

    private JobPriority() {}

    static void validate(int priority) {
        if (priority < LIVE || priority > BACKFILL) {
            throw new IllegalArgumentException("Job priority must be between " + LIVE + " and " + BACKFILL + ": " + priority);
        }
    }
}
