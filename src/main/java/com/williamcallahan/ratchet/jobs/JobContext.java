package com.williamcallahan.ratchet.jobs;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Execution context handed to a worker for one attempt.
 *
 * <p>Long-running bodies poll {@link #throwIfCancelled()} between external calls; blocking calls are
 * additionally interrupted by the runner when the deadline passes.</p>
 */
public final class JobContext {
    private final long jobId;
    private final int attempt;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public JobContext(long jobId, int attempt, Instant deadline) {
        this.jobId = jobId;
        this.attempt = attempt;
        this.deadline = deadline;
    }

    public long jobId() {
        return jobId;
    }

    public int attempt() {
        return attempt;
    }

    public Instant deadline() {
        return deadline;
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new JobCancelledException("Job " + jobId + " cancelled on attempt " + attempt);
        }
    }

    void cancel() {
        cancelled.set(true);
    }
}
