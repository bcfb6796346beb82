package com.williamcallahan.ratchet.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.ratchet.jobs.args.MessagesIngestionArgs;
import com.williamcallahan.ratchet.support.H2TestDatabase;
import com.williamcallahan.ratchet.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies how the runner settles job attempts: completion, retry, timeout and undecodable payloads.
 */
class JobRunnerTest {

    private H2TestDatabase database;
    private JdbcJobQueue queue;

    @BeforeEach
    void setUp() {
        database = H2TestDatabase.create();
        queue = database.jobQueue(new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void successfulAttemptCompletesJob() {
        List<String> seen = new CopyOnWriteArrayList<>();
        JobRunner runner = runnerFor(new RecordingWorker(Duration.ofSeconds(5), args -> seen.add(args.channelId())));
        long id = queue.enqueue(new MessagesIngestionArgs("C1")).orElseThrow();

        assertTrue(runner.runNext(MessagesIngestionArgs.KIND));

        assertEquals(List.of("C1"), seen);
        assertEquals(JobState.COMPLETED, queue.find(id).orElseThrow().state());
        assertFalse(runner.runNext(MessagesIngestionArgs.KIND), "queue is drained");
    }

    @Test
    void failingAttemptIsScheduledForRetry() {
        JobRunner runner = runnerFor(new RecordingWorker(Duration.ofSeconds(5), args -> {
            throw new IllegalStateException("slack unavailable");
        }));
        long id = queue.enqueue(new MessagesIngestionArgs("C1")).orElseThrow();

        runner.runNext(MessagesIngestionArgs.KIND);

        JobRow row = queue.find(id).orElseThrow();
        assertEquals(JobState.RETRYABLE, row.state());
        assertEquals("IllegalStateException: slack unavailable", row.lastError());
    }

    @Test
    void attemptExceedingTimeoutIsCancelled() {
        JobRunner runner = runnerFor(new RecordingWorker(Duration.ofMillis(200), args -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            }
        }));
        long id = queue.enqueue(new MessagesIngestionArgs("C1")).orElseThrow();

        runner.runNext(MessagesIngestionArgs.KIND);

        JobRow row = queue.find(id).orElseThrow();
        assertEquals(JobState.RETRYABLE, row.state());
        assertTrue(row.lastError().startsWith("deadline of PT0.2S exceeded"), row.lastError());
        assertFalse(Thread.currentThread().isInterrupted(), "interrupt flag is cleared after the attempt");
    }

    @Test
    void undecodableArgsAreDiscarded() {
        JobRunner runner = runnerFor(new RecordingWorker(Duration.ofSeconds(5), args -> {}));
        long id = queue.enqueue(new MessagesIngestionArgs("C1")).orElseThrow();
        database.jdbcTemplate().update("UPDATE jobs SET args = '[1,2]' WHERE id = ?", id);

        runner.runNext(MessagesIngestionArgs.KIND);

        assertEquals(JobState.DISCARDED, queue.find(id).orElseThrow().state());
    }

    @Test
    void unknownKindIsRejected() {
        JobRunner runner = runnerFor(new RecordingWorker(Duration.ofSeconds(5), args -> {}));

        assertThrows(IllegalArgumentException.class, () -> runner.runNext("nope"));
    }

    @Test
    void duplicateWorkersForOneKindAreRejected() {
        RecordingWorker worker = new RecordingWorker(Duration.ofSeconds(5), args -> {});

        assertThrows(IllegalStateException.class,
                () -> new JobRunner(queue, List.of(worker, worker), Map.of(), 1, Duration.ofSeconds(1)));
    }

    private JobRunner runnerFor(JobWorker<?> worker) {
        return new JobRunner(queue, List.of(worker), Map.of(), 1, Duration.ofSeconds(1));
    }

    private static final class RecordingWorker implements JobWorker<MessagesIngestionArgs> {
        private final Duration timeout;
        private final Consumer<MessagesIngestionArgs> body;

        RecordingWorker(Duration timeout, Consumer<MessagesIngestionArgs> body) {
            this.timeout = timeout;
            this.body = body;
        }

        @Override
        public String kind() {
            return MessagesIngestionArgs.KIND;
        }

        @Override
        public Class<MessagesIngestionArgs> argsType() {
            return MessagesIngestionArgs.class;
        }

        @Override
        public Duration timeout() {
            return timeout;
        }

        @Override
        public void work(JobContext context, MessagesIngestionArgs args) {
            body.accept(args);
            context.throwIfCancelled();
        }
    }
}
