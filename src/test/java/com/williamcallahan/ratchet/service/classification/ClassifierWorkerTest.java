package com.williamcallahan.ratchet.service.classification;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.williamcallahan.ratchet.domain.ChatMessage;
import com.williamcallahan.ratchet.domain.IncidentAction;
import com.williamcallahan.ratchet.domain.IncidentPriority;
import com.williamcallahan.ratchet.domain.MessageAttributesV1;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import com.williamcallahan.ratchet.domain.StoredMessage;
import com.williamcallahan.ratchet.domain.errors.MessageNotFoundException;
import com.williamcallahan.ratchet.jobs.JobContext;
import com.williamcallahan.ratchet.jobs.args.ClassifierArgs;
import com.williamcallahan.ratchet.service.EmbeddingClient;
import com.williamcallahan.ratchet.service.EmbeddingServiceUnavailableException;
import com.williamcallahan.ratchet.service.modules.MessageModuleChain;
import com.williamcallahan.ratchet.store.MessageStore;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Verifies the classification job: verdict, embedding, persistence, then module dispatch.
 */
class ClassifierWorkerTest {

    private static final String CHANNEL = "C1";
    private static final SlackTimestamp TS = SlackTimestamp.parse("101.000000");
    private static final JobContext CONTEXT = new JobContext(9L, 1, Instant.now().plusSeconds(60));

    private MessageStore store;
    private IncidentClassifier classifier;
    private EmbeddingClient embeddingClient;
    private MessageModuleChain modules;
    private ClassifierWorker worker;

    @BeforeEach
    void setUp() {
        store = mock(MessageStore.class);
        classifier = mock(IncidentClassifier.class);
        embeddingClient = mock(EmbeddingClient.class);
        modules = mock(MessageModuleChain.class);
        worker = new ClassifierWorker(store, classifier, embeddingClient, modules, Duration.ofSeconds(30));
    }

    @Test
    void storesVerdictAndEmbeddingThenDispatches() {
        IncidentAction open = IncidentAction.open("db", "cpu", IncidentPriority.HIGH);
        float[] vector = {0.1f, 0.2f};
        when(store.findMessage(CHANNEL, TS)).thenReturn(Optional.of(stored("db cpu high")));
        when(classifier.classify("U1", "db cpu high")).thenReturn(open);
        when(embeddingClient.embed("db cpu high")).thenReturn(vector);

        worker.work(CONTEXT, new ClassifierArgs(CHANNEL, TS.value(), true));

        ArgumentCaptor<MessageAttributesV1> saved = ArgumentCaptor.forClass(MessageAttributesV1.class);
        verify(store).updateMessage(eq(CHANNEL), eq(TS), saved.capture(), eq(vector));
        assertEquals(open, saved.getValue().incidentAction());
        verify(modules).dispatch(CHANNEL, TS, saved.getValue(), true);
    }

    @Test
    void blankTextIsNotEmbedded() {
        when(store.findMessage(CHANNEL, TS)).thenReturn(Optional.of(stored("")));
        when(classifier.classify(any(), any())).thenReturn(IncidentAction.none());

        worker.work(CONTEXT, new ClassifierArgs(CHANNEL, TS.value(), false));

        verifyNoInteractions(embeddingClient);
        verify(store).updateMessage(eq(CHANNEL), eq(TS), any(), isNull());
    }

    @Test
    void missingMessageCompletesWithoutClassifying() {
        when(store.findMessage(CHANNEL, TS)).thenReturn(Optional.empty());

        assertDoesNotThrow(() -> worker.work(CONTEXT, new ClassifierArgs(CHANNEL, TS.value(), false)));

        verifyNoInteractions(classifier, embeddingClient, modules);
        verify(store, never()).updateMessage(any(), any(), any(), any());
    }

    @Test
    void messagePurgedDuringClassificationCompletesWithoutDispatch() {
        when(store.findMessage(CHANNEL, TS)).thenReturn(Optional.of(stored("text")));
        when(classifier.classify(any(), any())).thenReturn(IncidentAction.none());
        when(embeddingClient.embed("text")).thenReturn(new float[] {0.5f});
        doThrow(new MessageNotFoundException(CHANNEL, TS.value()))
                .when(store).updateMessage(eq(CHANNEL), eq(TS), any(), any());

        assertDoesNotThrow(() -> worker.work(CONTEXT, new ClassifierArgs(CHANNEL, TS.value(), false)));

        verifyNoInteractions(modules);
    }

    @Test
    void embeddingFailureLeavesMessageUntouched() {
        when(store.findMessage(CHANNEL, TS)).thenReturn(Optional.of(stored("text")));
        when(classifier.classify(any(), any())).thenReturn(IncidentAction.none());
        when(embeddingClient.embed("text")).thenThrow(new EmbeddingServiceUnavailableException("HTTP 503"));

        assertThrows(EmbeddingServiceUnavailableException.class,
                () -> worker.work(CONTEXT, new ClassifierArgs(CHANNEL, TS.value(), false)));

        verify(store, never()).updateMessage(any(), any(), any(), any());
        verify(modules, never()).dispatch(any(), any(), any(), anyBoolean());
    }

    @Test
    void retriesOnFixedDelay() {
        assertEquals(Duration.ofSeconds(30), worker.nextRetry(1));
        assertEquals(Duration.ofSeconds(30), worker.nextRetry(20));
    }

    private static StoredMessage stored(String text) {
        return new StoredMessage(CHANNEL, TS, MessageAttributesV1.of(ChatMessage.of(TS.value(), "U1", text)), null);
    }
}
