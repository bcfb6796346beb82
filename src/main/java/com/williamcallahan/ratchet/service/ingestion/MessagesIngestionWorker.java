package com.williamcallahan.ratchet.service.ingestion;

import com.williamcallahan.ratchet.chat.ChatClient;
import com.williamcallahan.ratchet.chat.HistoryPage;
import com.williamcallahan.ratchet.domain.ChannelRecord;
import com.williamcallahan.ratchet.domain.ChatMessage;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import com.williamcallahan.ratchet.domain.errors.UnknownChannelException;
import com.williamcallahan.ratchet.jobs.JobContext;
import com.williamcallahan.ratchet.jobs.JobWorker;
import com.williamcallahan.ratchet.jobs.RetryPolicy;
import com.williamcallahan.ratchet.jobs.args.MessagesIngestionArgs;
import com.williamcallahan.ratchet.store.MessageStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * One polling pass over a channel's history.
 *
 * <p>Fetches everything newer than the watermark page by page. Pages arrive newest first, so each page
 * commits only its messages and their classification jobs. The watermark moves to the newest message of
 * the pass in the last page's transaction, together with scheduling the next pass: immediately when the
 * pass found messages, after the idle backoff otherwise. A pass that fails part-way leaves the watermark
 * where it was; the retry re-reads the same range and already stored messages collapse.</p>
 */
public class MessagesIngestionWorker implements JobWorker<MessagesIngestionArgs> {
    private static final Logger log = LoggerFactory.getLogger(MessagesIngestionWorker.class);

    private final MessageStore store;
    private final ChatClient chatClient;
    private final MessageIngestionService ingestionService;
    private final WatermarkTracker watermarkTracker;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final IngestionTiming timing;

    public MessagesIngestionWorker(
            MessageStore store,
            ChatClient chatClient,
            MessageIngestionService ingestionService,
            WatermarkTracker watermarkTracker,
            TransactionTemplate transactionTemplate,
            Clock clock,
            IngestionTiming timing) {
        this.store = store;
        this.chatClient = chatClient;
        this.ingestionService = ingestionService;
        this.watermarkTracker = watermarkTracker;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.timing = timing;
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
        return Duration.ofMinutes(5);
    }

    @Override
    public Duration nextRetry(int attempt) {
        return RetryPolicy.fixed(timing.retryBackoff());
    }

    @Override
    public void work(JobContext context, MessagesIngestionArgs args) {
        String channelId = args.channelId();
        ChannelRecord channel = store.findChannel(channelId).orElseThrow(() -> new UnknownChannelException(channelId));
        if (!channel.enabled()) {
            log.info("[INGEST] Channel {} is disabled; polling stops", channelId);
            return;
        }
        SlackTimestamp oldest = channel.latestWatermark()
                .orElseGet(() -> SlackTimestamp.of(clock.instant().minus(timing.initialLookback())));

        int ingested = 0;
        SlackTimestamp newest = null;
        String cursor = null;
        do {
            context.throwIfCancelled();
            HistoryPage page = chatClient.fetchHistory(channelId, oldest, cursor);
            List<ChatMessage> fresh = newerThan(page.messages(), oldest);
            boolean lastPage = !page.hasMore();
            int pageIngested = ingested + fresh.size();
            SlackTimestamp passNewest = newestOf(newest, fresh);

            context.throwIfCancelled();
            transactionTemplate.executeWithoutResult(status -> {
                ingestionService.addMessages(channelId, fresh, MessageSource.LIVE);
                if (lastPage) {
                    if (passNewest != null) {
                        watermarkTracker.advance(channelId, passNewest);
                    }
                    Instant now = clock.instant();
                    ingestionService.scheduleIngestion(
                            channelId, pageIngested > 0 ? now : now.plus(timing.emptyPollBackoff()));
                }
            });
            ingested = pageIngested;
            newest = passNewest;
            cursor = page.nextCursor();
        } while (cursor != null);

        log.debug("[INGEST] Pass over {} since {} saw {} new message(s)", channelId, oldest, ingested);
    }

    private static SlackTimestamp newestOf(SlackTimestamp current, List<ChatMessage> fresh) {
        SlackTimestamp newest = current;
        for (ChatMessage message : fresh) {
            if (newest == null || message.timestamp().isAfter(newest)) {
                newest = message.timestamp();
            }
        }
        return newest;
    }

    private static List<ChatMessage> newerThan(List<ChatMessage> messages, SlackTimestamp oldest) {
        return messages.stream()
                .filter(message -> message.timestamp().isAfter(oldest))
                .sorted((left, right) -> left.timestamp().compareTo(right.timestamp()))
                .toList();
    }

    /**
     * @param emptyPollBackoff wait before the next pass when a pass found nothing
     * @param initialLookback how far back the first pass reaches when a channel has no watermark
     * @param retryBackoff wait after a failed pass
     */
    public record IngestionTiming(Duration emptyPollBackoff, Duration initialLookback, Duration retryBackoff) {}
}
