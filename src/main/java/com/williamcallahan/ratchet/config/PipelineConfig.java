package com.williamcallahan.ratchet.config;

import com.williamcallahan.ratchet.chat.ChatClient;
import com.williamcallahan.ratchet.jobs.JobQueue;
import com.williamcallahan.ratchet.service.EmbeddingClient;
import com.williamcallahan.ratchet.service.classification.ClassifierWorker;
import com.williamcallahan.ratchet.service.classification.IncidentClassifier;
import com.williamcallahan.ratchet.service.incident.IncidentModule;
import com.williamcallahan.ratchet.service.incident.IncidentStateMachine;
import com.williamcallahan.ratchet.service.ingestion.BackfillThreadWorker;
import com.williamcallahan.ratchet.service.ingestion.ChannelBootstrap;
import com.williamcallahan.ratchet.service.ingestion.ChannelInfoWorker;
import com.williamcallahan.ratchet.service.ingestion.ChannelOnboardWorker;
import com.williamcallahan.ratchet.service.ingestion.MessageIngestionService;
import com.williamcallahan.ratchet.service.ingestion.MessagesIngestionWorker;
import com.williamcallahan.ratchet.service.ingestion.WatermarkTracker;
import com.williamcallahan.ratchet.service.modules.MessageModule;
import com.williamcallahan.ratchet.service.modules.MessageModuleChain;
import com.williamcallahan.ratchet.store.MessageStore;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Ingestion, classification and incident services, and the job workers that drive them.
 */
@Configuration
public class PipelineConfig {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public WatermarkTracker watermarkTracker(MessageStore messageStore) {
        return new WatermarkTracker(messageStore);
    }

    @Bean
    public MessageIngestionService messageIngestionService(
            MessageStore messageStore,
            JobQueue jobQueue,
            TransactionTemplate transactionTemplate,
            Clock clock,
            AppProperties appProperties) {
        AppProperties.Ingestion ingestion = appProperties.getIngestion();
        return new MessageIngestionService(
                messageStore,
                jobQueue,
                transactionTemplate,
                clock,
                ingestion.getRetention(),
                ingestion.getOnboardMessageLimit());
    }

    @Bean
    public IncidentStateMachine incidentStateMachine(MessageStore messageStore, TransactionTemplate transactionTemplate) {
        return new IncidentStateMachine(messageStore, transactionTemplate);
    }

    @Bean
    public IncidentModule incidentModule(IncidentStateMachine incidentStateMachine) {
        return new IncidentModule(incidentStateMachine);
    }

    @Bean
    public MessageModuleChain messageModuleChain(List<MessageModule> modules) {
        MessageModuleChain chain = new MessageModuleChain(modules);
        log.info("[MODULES] Registered message modules {}", chain.moduleNames());
        return chain;
    }

    @Bean
    public MessagesIngestionWorker messagesIngestionWorker(
            MessageStore messageStore,
            ChatClient chatClient,
            MessageIngestionService messageIngestionService,
            WatermarkTracker watermarkTracker,
            TransactionTemplate transactionTemplate,
            Clock clock,
            AppProperties appProperties) {
        AppProperties.Ingestion ingestion = appProperties.getIngestion();
        return new MessagesIngestionWorker(
                messageStore,
                chatClient,
                messageIngestionService,
                watermarkTracker,
                transactionTemplate,
                clock,
                new MessagesIngestionWorker.IngestionTiming(
                        ingestion.getEmptyPollBackoff(), ingestion.getInitialLookback(), ingestion.getRetryBackoff()));
    }

    @Bean
    public ClassifierWorker classifierWorker(
            MessageStore messageStore,
            IncidentClassifier incidentClassifier,
            EmbeddingClient embeddingClient,
            MessageModuleChain messageModuleChain,
            AppProperties appProperties) {
        return new ClassifierWorker(
                messageStore,
                incidentClassifier,
                embeddingClient,
                messageModuleChain,
                appProperties.getClassifier().getRetryBackoff());
    }

    @Bean
    public ChannelOnboardWorker channelOnboardWorker(
            ChatClient chatClient,
            MessageIngestionService messageIngestionService,
            WatermarkTracker watermarkTracker,
            MessageStore messageStore,
            JobQueue jobQueue,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        return new ChannelOnboardWorker(
                chatClient, messageIngestionService, watermarkTracker, messageStore, jobQueue, transactionTemplate, clock);
    }

    @Bean
    public BackfillThreadWorker backfillThreadWorker(
            ChatClient chatClient,
            MessageIngestionService messageIngestionService,
            TransactionTemplate transactionTemplate,
            AppProperties appProperties) {
        return new BackfillThreadWorker(
                chatClient, messageIngestionService, transactionTemplate, appProperties.getIngestion().getRetryBackoff());
    }

    @Bean
    public ChannelInfoWorker channelInfoWorker(ChatClient chatClient, MessageStore messageStore) {
        return new ChannelInfoWorker(chatClient, messageStore);
    }

    @Bean
    public ChannelBootstrap channelBootstrap(
            AppProperties appProperties,
            MessageIngestionService messageIngestionService,
            MessageStore messageStore,
            Clock clock) {
        return new ChannelBootstrap(appProperties.getIngestion().getChannels(), messageIngestionService, messageStore, clock);
    }
}
