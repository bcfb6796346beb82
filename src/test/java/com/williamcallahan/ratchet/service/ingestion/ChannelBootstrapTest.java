package com.williamcallahan.ratchet.service.ingestion;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.ratchet.domain.ChannelAttributes;
import com.williamcallahan.ratchet.domain.ChannelRecord;
import com.williamcallahan.ratchet.domain.OnboardingStatus;
import com.williamcallahan.ratchet.store.MessageStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

/**
 * Startup registration and polling re-arm.
 */
class ChannelBootstrapTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final MessageIngestionService ingestionService = mock(MessageIngestionService.class);
    private final MessageStore store = mock(MessageStore.class);

    @Test
    void registersConfiguredChannelsAndArmsOnlyOnboardedEnabledChannels() {
        when(store.listChannels()).thenReturn(List.of(
                new ChannelRecord("C1", new ChannelAttributes(OnboardingStatus.FINISHED, "ops"), null, true),
                new ChannelRecord("C2", new ChannelAttributes(OnboardingStatus.STARTED, null), null, true),
                new ChannelRecord("C3", new ChannelAttributes(OnboardingStatus.FINISHED, null), null, false)));
        ChannelBootstrap bootstrap = new ChannelBootstrap(
                List.of(" C1 ", "", "C2"), ingestionService, store, Clock.fixed(NOW, ZoneOffset.UTC));

        bootstrap.run(new DefaultApplicationArguments());

        verify(ingestionService).registerChannel("C1");
        verify(ingestionService).registerChannel("C2");
        verify(ingestionService).scheduleIngestion("C1", NOW);
        verify(ingestionService, never()).scheduleIngestion(eq("C2"), any(Instant.class));
        verify(ingestionService, never()).scheduleIngestion(eq("C3"), any(Instant.class));
        verify(ingestionService, never()).registerChannel("");
    }
}
