package com.williamcallahan.ratchet.service.ingestion;

import com.williamcallahan.ratchet.domain.ChannelRecord;
import com.williamcallahan.ratchet.domain.OnboardingStatus;
import com.williamcallahan.ratchet.store.MessageStore;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/**
 * Startup registration of configured channels, and re-arming of the polling loop for every onboarded
 * channel in case its pending pass was lost.
 */
public class ChannelBootstrap implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ChannelBootstrap.class);

    private final List<String> configuredChannels;
    private final MessageIngestionService ingestionService;
    private final MessageStore store;
    private final Clock clock;

    public ChannelBootstrap(
            List<String> configuredChannels, MessageIngestionService ingestionService, MessageStore store, Clock clock) {
        this.configuredChannels = List.copyOf(configuredChannels);
        this.ingestionService = ingestionService;
        this.store = store;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        for (String channelId : configuredChannels) {
            if (!channelId.isBlank() && ingestionService.registerChannel(channelId.trim())) {
                log.info("[INGEST] Registered configured channel {}", channelId.trim());
            }
        }
        int armed = 0;
        for (ChannelRecord channel : store.listChannels()) {
            if (channel.enabled() && channel.attributes().onboardingStatus() == OnboardingStatus.FINISHED) {
                ingestionService.scheduleIngestion(channel.id(), clock.instant());
                armed++;
            }
        }
        log.info("[INGEST] Polling armed for {} channel(s)", armed);
    }
}
