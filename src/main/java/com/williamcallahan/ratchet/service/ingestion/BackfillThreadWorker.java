package com.williamcallahan.ratchet.service.ingestion;

import com.williamcallahan.ratchet.chat.ChatClient;
import com.williamcallahan.ratchet.domain.ChatMessage;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import com.williamcallahan.ratchet.jobs.JobContext;
import com.williamcallahan.ratchet.jobs.JobWorker;
import com.williamcallahan.ratchet.jobs.RetryPolicy;
import com.williamcallahan.ratchet.jobs.args.BackfillThreadArgs;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Stores the replies of one thread found during onboarding.
 */
public class BackfillThreadWorker implements JobWorker<BackfillThreadArgs> {
    private static final Logger log = LoggerFactory.getLogger(BackfillThreadWorker.class);

    private final ChatClient chatClient;
    private final MessageIngestionService ingestionService;
    private final TransactionTemplate transactionTemplate;
    private final Duration retryBackoff;

    public BackfillThreadWorker(
            ChatClient chatClient,
            MessageIngestionService ingestionService,
            TransactionTemplate transactionTemplate,
            Duration retryBackoff) {
        this.chatClient = chatClient;
        this.ingestionService = ingestionService;
        this.transactionTemplate = transactionTemplate;
        this.retryBackoff = retryBackoff;
    }

    @Override
    public String kind() {
        return BackfillThreadArgs.KIND;
    }

    @Override
    public Class<BackfillThreadArgs> argsType() {
        return BackfillThreadArgs.class;
    }

    @Override
    public Duration nextRetry(int attempt) {
        return RetryPolicy.fixed(retryBackoff);
    }

    @Override
    public void work(JobContext context, BackfillThreadArgs args) {
        SlackTimestamp parentTs = SlackTimestamp.parse(args.slackTs());
        List<ChatMessage> replies = chatClient.fetchReplies(args.channelId(), parentTs);
        context.throwIfCancelled();
        Integer stored = transactionTemplate.execute(
                status -> ingestionService.addThreadMessages(args.channelId(), parentTs, replies));
        log.debug("[INGEST] Thread {} in {}: stored {} of {} replies", parentTs, args.channelId(), stored, replies.size());
    }
}
