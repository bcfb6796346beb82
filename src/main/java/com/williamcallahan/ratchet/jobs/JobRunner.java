package com.williamcallahan.ratchet.jobs;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Polls the queue and runs claimed jobs on bounded per-kind worker pools.
 *
 * <p>Each kind owns a fixed pool and a semaphore of the same size, so a burst of one kind never starves
 * another. Every attempt runs under a watchdog that cancels its {@link JobContext} and interrupts the
 * worker thread once {@link JobWorker#timeout()} elapses.</p>
 */
public class JobRunner implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private static final long SHUTDOWN_GRACE_SECONDS = 10;

    private final JobQueue queue;
    private final Map<String, WorkerSlot<?>> slots = new LinkedHashMap<>();
    private final Duration pollInterval;
    private final ScheduledExecutorService poller;
    private final ScheduledExecutorService watchdog;
    private final AtomicBoolean running = new AtomicBoolean();

    /**
     * @param queue job source
     * @param workers one worker per kind
     * @param concurrency per-kind pool sizes; kinds not listed use {@code defaultConcurrency}
     * @param defaultConcurrency pool size for unlisted kinds
     * @param pollInterval delay between polls
     */
    public JobRunner(
            JobQueue queue,
            List<? extends JobWorker<?>> workers,
            Map<String, Integer> concurrency,
            int defaultConcurrency,
            Duration pollInterval) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        for (JobWorker<?> worker : workers) {
            int size = Math.max(1, concurrency.getOrDefault(worker.kind(), defaultConcurrency));
            if (slots.put(worker.kind(), newSlot(worker, size)) != null) {
                throw new IllegalStateException("Duplicate worker registered for job kind " + worker.kind());
            }
        }
        this.poller = Executors.newSingleThreadScheduledExecutor(namedThreads("jobs-poller"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(namedThreads("jobs-watchdog"));
    }

    private static <A extends JobArgs> WorkerSlot<A> newSlot(JobWorker<A> worker, int size) {
        return new WorkerSlot<>(
                worker, Executors.newFixedThreadPool(size, namedThreads("jobs-" + worker.kind())), new Semaphore(size));
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("[JOBS] Starting runner for kinds {} (poll every {})", slots.keySet(), pollInterval);
            poller.scheduleWithFixedDelay(this::pollSafely, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("[JOBS] Stopping runner");
        poller.shutdownNow();
        for (WorkerSlot<?> slot : slots.values()) {
            slot.executor().shutdown();
        }
        for (WorkerSlot<?> slot : slots.values()) {
            awaitQuietly(slot.executor());
        }
        watchdog.shutdownNow();
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Claims as many jobs as there are free slots and hands them to the pools.
     *
     * @return number of jobs dispatched
     */
    public int poll() {
        int dispatched = 0;
        for (WorkerSlot<?> slot : slots.values()) {
            int free = slot.permits().availablePermits();
            if (free == 0) {
                continue;
            }
            for (JobRow job : queue.claim(slot.worker().kind(), free)) {
                dispatch(slot, job);
                dispatched++;
            }
        }
        return dispatched;
    }

    /**
     * Claims and runs one job of the given kind on the calling thread.
     *
     * @return false when nothing of that kind was runnable
     */
    public boolean runNext(String kind) {
        WorkerSlot<?> slot = slots.get(kind);
        if (slot == null) {
            throw new IllegalArgumentException("No worker registered for job kind " + kind);
        }
        Optional<JobRow> job = queue.claim(kind, 1).stream().findFirst();
        job.ifPresent(claimed -> execute(slot.worker(), claimed));
        return job.isPresent();
    }

    private void pollSafely() {
        try {
            poll();
        } catch (RuntimeException pollFailure) {
            log.error("[JOBS] Poll failed; retrying in {}", pollInterval, pollFailure);
        }
    }

    private void dispatch(WorkerSlot<?> slot, JobRow job) {
        if (!slot.permits().tryAcquire()) {
            queue.fail(job, Duration.ZERO, "no free worker slot");
            return;
        }
        try {
            slot.executor().execute(() -> {
                try {
                    execute(slot.worker(), job);
                } finally {
                    slot.permits().release();
                }
            });
        } catch (RejectedExecutionException shuttingDown) {
            slot.permits().release();
            queue.fail(job, Duration.ZERO, "runner shutting down");
        }
    }

    <A extends JobArgs> void execute(JobWorker<A> worker, JobRow job) {
        A args;
        try {
            args = queue.decodeArgs(job, worker.argsType());
        } catch (IllegalArgumentException undecodable) {
            log.error("[JOBS] Discarding {} job {}: {}", job.kind(), job.id(), undecodable.getMessage());
            queue.discard(job, undecodable.getMessage());
            return;
        }

        Duration timeout = worker.timeout();
        JobContext context = new JobContext(job.id(), job.attempt(), Instant.now().plus(timeout));
        Thread jobThread = Thread.currentThread();
        AtomicBoolean finished = new AtomicBoolean();
        ScheduledFuture<?> deadline = watchdog.schedule(
                () -> {
                    if (!finished.get()) {
                        log.warn("[JOBS] {} job {} exceeded {}; cancelling", job.kind(), job.id(), timeout);
                        context.cancel();
                        jobThread.interrupt();
                    }
                },
                timeout.toMillis(),
                TimeUnit.MILLISECONDS);

        long startedAt = System.currentTimeMillis();
        RuntimeException failure = null;
        try {
            worker.work(context, args);
        } catch (RuntimeException workFailure) {
            failure = workFailure;
        } finally {
            finished.set(true);
            deadline.cancel(false);
            Thread.interrupted();
        }

        if (failure == null) {
            queue.complete(job);
            log.debug("[JOBS] {} job {} completed in {}ms", job.kind(), job.id(), System.currentTimeMillis() - startedAt);
            return;
        }
        String error = describe(failure, context.isCancelled() ? timeout : null);
        JobState outcome = queue.fail(job, worker.nextRetry(job.attempt()), error);
        log.warn("[JOBS] {} job {} attempt {}/{} failed ({}): {}",
                job.kind(), job.id(), job.attempt(), job.maxAttempts(), outcome.column(), error);
    }

    private static String describe(RuntimeException failure, Duration exceededTimeout) {
        String message = failure.getMessage() == null ? "" : failure.getMessage();
        String description = failure.getClass().getSimpleName() + (message.isBlank() ? "" : ": " + message);
        return exceededTimeout == null ? description : "deadline of " + exceededTimeout + " exceeded; " + description;
    }

    private static void awaitQuietly(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException interrupted) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record WorkerSlot<A extends JobArgs>(JobWorker<A> worker, ExecutorService executor, Semaphore permits) {}
}
