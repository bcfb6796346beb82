package com.williamcallahan.ratchet.service.ingestion;

import com.williamcallahan.ratchet.chat.ChannelInfo;
import com.williamcallahan.ratchet.chat.ChatClient;
import com.williamcallahan.ratchet.chat.HistoryPage;
import com.williamcallahan.ratchet.domain.ChannelAttributes;
import com.williamcallahan.ratchet.domain.ChatMessage;
import com.williamcallahan.ratchet.domain.OnboardingStatus;
import com.williamcallahan.ratchet.jobs.InsertOptions;
import com.williamcallahan.ratchet.jobs.JobContext;
import com.williamcallahan.ratchet.jobs.JobQueue;
import com.williamcallahan.ratchet.jobs.JobWorker;
import com.williamcallahan.ratchet.jobs.args.BackfillThreadArgs;
import com.williamcallahan.ratchet.jobs.args.ChannelOnboardArgs;
import com.williamcallahan.ratchet.store.MessageStore;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Replays the most recent history of a newly registered channel as backfill, then hands the channel
 * over to the polling loop.
 */
public class ChannelOnboardWorker implements JobWorker<ChannelOnboardArgs> {
    private static final Logger log = LoggerFactory.getLogger(ChannelOnboardWorker.class);

    private final ChatClient chatClient;
    private final MessageIngestionService ingestionService;
    private final WatermarkTracker watermarkTracker;
    private final MessageStore store;
    private final JobQueue jobQueue;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ChannelOnboardWorker(
            ChatClient chatClient,
            MessageIngestionService ingestionService,
            WatermarkTracker watermarkTracker,
            MessageStore store,
            JobQueue jobQueue,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.chatClient = chatClient;
        this.ingestionService = ingestionService;
        this.watermarkTracker = watermarkTracker;
        this.store = store;
        this.jobQueue = jobQueue;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Override
    public String kind() {
        return ChannelOnboardArgs.KIND;
    }

    @Override
    public Class<ChannelOnboardArgs> argsType() {
        return ChannelOnboardArgs.class;
    }

    @Override
    public Duration timeout() {
        return Duration.ofMinutes(5);
    }

    @Override
    public void work(JobContext context, ChannelOnboardArgs args) {
        String channelId = args.channelId();
        ChannelInfo info = chatClient.fetchChannelInfo(channelId);
        List<ChatMessage> recent = fetchRecent(context, channelId, args.lastNMessages());

        context.throwIfCancelled();
        transactionTemplate.executeWithoutResult(status -> {
            ingestionService.addMessages(channelId, recent, MessageSource.BACKFILL);
            for (ChatMessage message : recent) {
                if (message.hasReplies()) {
                    jobQueue.enqueue(
                            new BackfillThreadArgs(channelId, message.ts()),
                            InsertOptions.backfill().uniqueBy(channelId + "/" + message.ts()));
                }
            }
            if (!recent.isEmpty()) {
                watermarkTracker.advance(channelId, recent.get(recent.size() - 1).timestamp());
            }
            store.updateChannelAttributes(channelId, new ChannelAttributes(OnboardingStatus.FINISHED, info.name()));
            ingestionService.scheduleIngestion(channelId, clock.instant());
        });
        log.info("[INGEST] Onboarded #{} ({}) with {} backfilled message(s)", info.name(), channelId, recent.size());
    }

    private List<ChatMessage> fetchRecent(JobContext context, String channelId, int limit) {
        List<ChatMessage> collected = new ArrayList<>();
        String cursor = null;
        do {
            context.throwIfCancelled();
            HistoryPage page = chatClient.fetchHistory(channelId, null, cursor);
            collected.addAll(page.messages());
            cursor = page.nextCursor();
        } while (cursor != null && collected.size() < limit);

        List<ChatMessage> ascending = collected.stream()
                .sorted(Comparator.comparing(ChatMessage::timestamp))
                .toList();
        int from = Math.max(0, ascending.size() - Math.max(limit, 0));
        return ascending.subList(from, ascending.size());
    }
}
