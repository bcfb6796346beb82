package com.williamcallahan.ratchet.service.ingestion;

import com.williamcallahan.ratchet.domain.SlackTimestamp;
import com.williamcallahan.ratchet.domain.errors.UnknownChannelException;
import com.williamcallahan.ratchet.store.MessageStore;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Per-channel high-water mark of committed ingestion. The mark only ever moves forward.
 */
public class WatermarkTracker {
    private static final Logger log = LoggerFactory.getLogger(WatermarkTracker.class);

    private final MessageStore store;

    public WatermarkTracker(MessageStore store) {
        this.store = store;
    }

    /**
     * @throws UnknownChannelException when the channel is not registered
     */
    public Optional<SlackTimestamp> current(String channelId) {
        return store.findChannel(channelId)
                .orElseThrow(() -> new UnknownChannelException(channelId))
                .latestWatermark();
    }

    /**
     * Moves the watermark to {@code candidate} when that is newer than the stored value. Must run inside
     * the transaction that commits the messages up to {@code candidate}.
     *
     * @return the watermark after the call
     * @throws UnknownChannelException when the channel is not registered
     */
    public SlackTimestamp advance(String channelId, SlackTimestamp candidate) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Watermark updates must run inside a transaction");
        }
        Optional<SlackTimestamp> stored = store.lockWatermark(channelId);
        if (stored.isPresent() && !candidate.isAfter(stored.get())) {
            log.debug("[INGEST] Watermark for {} stays at {} (candidate {})", channelId, stored.get(), candidate);
            return stored.get();
        }
        store.writeWatermark(channelId, candidate);
        return candidate;
    }
}
