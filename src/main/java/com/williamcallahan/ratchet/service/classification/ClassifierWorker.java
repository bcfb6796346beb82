package com.williamcallahan.ratchet.service.classification;

import com.williamcallahan.ratchet.domain.IncidentAction;
import com.williamcallahan.ratchet.domain.MessageAttributesV1;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import com.williamcallahan.ratchet.domain.StoredMessage;
import com.williamcallahan.ratchet.domain.errors.MessageNotFoundException;
import com.williamcallahan.ratchet.jobs.JobContext;
import com.williamcallahan.ratchet.jobs.JobWorker;
import com.williamcallahan.ratchet.jobs.RetryPolicy;
import com.williamcallahan.ratchet.jobs.args.ClassifierArgs;
import com.williamcallahan.ratchet.service.EmbeddingClient;
import com.williamcallahan.ratchet.service.modules.MessageModuleChain;
import com.williamcallahan.ratchet.store.MessageStore;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies one stored message, stores the verdict with the message embedding, then runs the
 * message modules.
 */
public class ClassifierWorker implements JobWorker<ClassifierArgs> {
    private static final Logger log = LoggerFactory.getLogger(ClassifierWorker.class);

    private final MessageStore store;
    private final IncidentClassifier classifier;
    private final EmbeddingClient embeddingClient;
    private final MessageModuleChain modules;
    private final Duration retryBackoff;

    public ClassifierWorker(
            MessageStore store,
            IncidentClassifier classifier,
            EmbeddingClient embeddingClient,
            MessageModuleChain modules,
            Duration retryBackoff) {
        this.store = store;
        this.classifier = classifier;
        this.embeddingClient = embeddingClient;
        this.modules = modules;
        this.retryBackoff = retryBackoff;
    }

    @Override
    public String kind() {
        return ClassifierArgs.KIND;
    }

    @Override
    public Class<ClassifierArgs> argsType() {
        return ClassifierArgs.class;
    }

    @Override
    public Duration nextRetry(int attempt) {
        return RetryPolicy.fixed(retryBackoff);
    }

    @Override
    public void work(JobContext context, ClassifierArgs args) {
        SlackTimestamp ts = SlackTimestamp.parse(args.slackTs());
        Optional<StoredMessage> message = store.findMessage(args.channelId(), ts);
        if (message.isEmpty()) {
            log.warn("[CLASSIFY] Message {} in {} is no longer stored; nothing to classify", ts, args.channelId());
            return;
        }
        MessageAttributesV1 attributes = message.get().attributes();

        context.throwIfCancelled();
        IncidentAction action = classifier.classify(attributes.senderName(), attributes.text());

        context.throwIfCancelled();
        String text = attributes.text();
        float[] embedding = text.isBlank() ? null : embeddingClient.embed(text);

        MessageAttributesV1 classified = attributes.withIncidentAction(action);
        try {
            store.updateMessage(args.channelId(), ts, classified, embedding);
        } catch (MessageNotFoundException purged) {
            log.warn("[CLASSIFY] Message {} in {} was removed while classifying; dropping verdict", ts, args.channelId());
            return;
        }
        log.info("[CLASSIFY] {} in {} -> {} (backfill={})",
                ts, args.channelId(), action.effectiveAction(), args.backfill());

        context.throwIfCancelled();
        modules.dispatch(args.channelId(), ts, classified, args.backfill());
    }
}
