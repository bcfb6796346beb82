package com.williamcallahan.ratchet.jobs;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable job queue.
 *
 * <p>{@link #enqueue} joins the caller's transaction, so a job becomes visible exactly when the data
 * it refers to commits.</p>
 */
public interface JobQueue {

    /**
     * Inserts a job.
     *
     * @return the job ID, or empty when another job of the same kind already holds the unique key
     */
    Optional<Long> enqueue(JobArgs args, InsertOptions options);

    default Optional<Long> enqueue(JobArgs args) {
        return enqueue(args, InsertOptions.defaults());
    }

    /**
     * Claims up to {@code limit} runnable jobs of one kind, lowest priority value first, and marks them running.
     * Claiming releases the job's unique key so a successor with the same key can be enqueued.
     */
    List<JobRow> claim(String kind, int limit);

    void complete(JobRow job);

    /**
     * Records a failed attempt.
     *
     * @return {@link JobState#RETRYABLE} when the job will run again, {@link JobState#DISCARDED} otherwise
     */
    JobState fail(JobRow job, Duration retryDelay, String error);

    void discard(JobRow job, String error);

    /**
     * Returns jobs stuck in {@code running} longer than {@code runningFor} to the retry path.
     *
     * @return number of jobs rescued
     */
    int rescueStuck(Duration runningFor);

    /**
     * Deletes completed and discarded jobs finalized before the cutoff.
     */
    int deleteFinalizedBefore(Instant cutoff);

    Optional<JobRow> find(long jobId);

    List<JobRow> listByKind(String kind);

    <A extends JobArgs> A decodeArgs(JobRow job, Class<A> argsType);
}
