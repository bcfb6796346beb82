package com.williamcallahan.ratchet.service.ingestion;

import com.williamcallahan.ratchet.domain.ChannelAttributes;
import com.williamcallahan.ratchet.domain.ChatMessage;
import com.williamcallahan.ratchet.domain.MessageAttributesV1;
import com.williamcallahan.ratchet.domain.OnboardingStatus;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import com.williamcallahan.ratchet.jobs.InsertOptions;
import com.williamcallahan.ratchet.jobs.JobQueue;
import com.williamcallahan.ratchet.jobs.args.ChannelOnboardArgs;
import com.williamcallahan.ratchet.jobs.args.ClassifierArgs;
import com.williamcallahan.ratchet.jobs.args.MessagesIngestionArgs;
import com.williamcallahan.ratchet.store.MessageStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Writes incoming messages and queues the work that follows from them.
 *
 * <p>A classification job is enqueued for exactly the messages a call newly stored, in the same
 * transaction as the insert. Messages older than the retention window are neither stored nor kept.</p>
 */
public class MessageIngestionService {
    private static final Logger log = LoggerFactory.getLogger(MessageIngestionService.class);

    private final MessageStore store;
    private final JobQueue jobQueue;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Duration retention;
    private final int onboardMessageLimit;

    /**
     * @param retention age after which messages are purged
     * @param onboardMessageLimit history depth replayed when a channel is first seen
     */
    public MessageIngestionService(
            MessageStore store,
            JobQueue jobQueue,
            TransactionTemplate transactionTemplate,
            Clock clock,
            Duration retention,
            int onboardMessageLimit) {
        this.store = Objects.requireNonNull(store, "store");
        this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.retention = Objects.requireNonNull(retention, "retention");
        this.onboardMessageLimit = onboardMessageLimit;
    }

    /**
     * Stores top-level messages and enqueues one classification job per newly stored message.
     * Must be called inside a transaction.
     *
     * @return timestamps of the messages this call stored
     * @throws com.williamcallahan.ratchet.domain.errors.UnknownChannelException when the channel is not registered
     */
    public List<SlackTimestamp> addMessages(String channelId, List<ChatMessage> messages, MessageSource source) {
        requireTransaction();
        SlackTimestamp cutoff = retentionCutoff();
        purgeExpired(channelId, cutoff);

        List<SlackTimestamp> stored = new ArrayList<>();
        for (ChatMessage message : messages) {
            SlackTimestamp ts = message.timestamp();
            if (!ts.isAfter(cutoff)) {
                continue;
            }
            if (store.insertMessage(channelId, ts, MessageAttributesV1.of(message))) {
                jobQueue.enqueue(new ClassifierArgs(channelId, ts.value(), source.isBackfill()), source.jobOptions());
                stored.add(ts);
            }
        }
        if (!stored.isEmpty()) {
            log.info("[INGEST] Stored {} new {} message(s) in {}", stored.size(), source.name().toLowerCase(Locale.ROOT), channelId);
        }
        return stored;
    }

    /**
     * Stores thread replies under {@code parentTs}. Replies whose parent is not stored are skipped.
     * Must be called inside a transaction.
     *
     * @return number of replies this call stored
     */
    public int addThreadMessages(String channelId, SlackTimestamp parentTs, List<ChatMessage> replies) {
        requireTransaction();
        int stored = 0;
        for (ChatMessage reply : replies) {
            if (store.insertThreadMessage(channelId, parentTs, reply.timestamp(), MessageAttributesV1.of(reply))) {
                stored++;
            }
        }
        return stored;
    }

    /**
     * Registers a channel if it is new and queues its onboarding.
     *
     * @return true when the channel was not known before
     */
    public boolean registerChannel(String channelId) {
        return Boolean.TRUE.equals(transactionTemplate.execute(status -> registerInCurrentTransaction(channelId)));
    }

    /**
     * Records one message delivered by the live event feed. Replies go to their thread; top-level messages
     * register their channel on first sight. The watermark is left alone.
     *
     * @return true when the message was newly stored
     */
    public boolean recordLiveMessage(String channelId, ChatMessage message) {
        return Boolean.TRUE.equals(transactionTemplate.execute(status -> {
            if (message.isThreadReply()) {
                SlackTimestamp parentTs = SlackTimestamp.parse(message.threadTs());
                return addThreadMessages(channelId, parentTs, List.of(message)) > 0;
            }
            registerInCurrentTransaction(channelId);
            return !addMessages(channelId, List.of(message), MessageSource.LIVE).isEmpty();
        }));
    }

    /**
     * Adjusts a reaction count on a stored message.
     *
     * @return false when the message is not stored
     */
    public boolean recordReaction(String channelId, SlackTimestamp ts, String reaction, int delta) {
        boolean applied = Boolean.TRUE.equals(
                transactionTemplate.execute(status -> store.applyReaction(channelId, ts, reaction, delta)));
        if (!applied) {
            log.debug("[INGEST] Reaction {} on unknown message {} in {}", reaction, ts, channelId);
        }
        return applied;
    }

    /**
     * Schedules the next polling pass for a channel. Collapses with a pass that is already pending.
     */
    public void scheduleIngestion(String channelId, Instant runAt) {
        jobQueue.enqueue(
                new MessagesIngestionArgs(channelId), InsertOptions.defaults().uniqueBy(channelId).scheduledAt(runAt));
    }

    private boolean registerInCurrentTransaction(String channelId) {
        if (!store.addChannel(channelId)) {
            return false;
        }
        store.updateChannelAttributes(channelId, new ChannelAttributes(OnboardingStatus.STARTED, null));
        jobQueue.enqueue(
                new ChannelOnboardArgs(channelId, onboardMessageLimit),
                InsertOptions.backfill().uniqueBy(channelId));
        log.info("[INGEST] New channel {}; onboarding queued (last {} messages)", channelId, onboardMessageLimit);
        return true;
    }

    private void purgeExpired(String channelId, SlackTimestamp cutoff) {
        int purged = store.deleteMessagesBefore(channelId, cutoff);
        if (purged > 0) {
            log.info("[INGEST] Purged {} message(s) older than {} from {}", purged, retention, channelId);
        }
    }

    private SlackTimestamp retentionCutoff() {
        Instant cutoff = clock.instant().minus(retention);
        return SlackTimestamp.of(cutoff.isBefore(Instant.EPOCH) ? Instant.EPOCH : cutoff);
    }

    private static void requireTransaction() {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Message writes must run inside a transaction");
        }
    }
}
