package com.williamcallahan.ratchet.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.williamcallahan.ratchet.chat.ChannelInfo;
import com.williamcallahan.ratchet.chat.ChatClient;
import com.williamcallahan.ratchet.domain.ChatMessage;
import com.williamcallahan.ratchet.domain.MessageAttributesV1;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import com.williamcallahan.ratchet.jobs.JobContext;
import com.williamcallahan.ratchet.jobs.args.BackfillThreadArgs;
import com.williamcallahan.ratchet.jobs.args.ChannelInfoArgs;
import com.williamcallahan.ratchet.store.JdbcMessageStore;
import com.williamcallahan.ratchet.support.H2TestDatabase;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ThreadAndChannelInfoWorkersTest {

    private static final String CHANNEL = "C1";
    private static final SlackTimestamp PARENT = SlackTimestamp.parse("150.000000");

    private H2TestDatabase database;
    private JdbcMessageStore store;
    private ChatClient chatClient;
    private MessageIngestionService ingestionService;

    @BeforeEach
    void setUp() {
        database = H2TestDatabase.create();
        Clock clock = Clock.fixed(Instant.ofEpochSecond(200), ZoneOffset.UTC);
        store = database.messageStore();
        chatClient = mock(ChatClient.class);
        ingestionService = new MessageIngestionService(
                store, database.jobQueue(clock), database.transactionTemplate(), clock, Duration.ofDays(730), 10);
        store.addChannel(CHANNEL);
        store.insertMessage(CHANNEL, PARENT, MessageAttributesV1.of(ChatMessage.of(PARENT.value(), "U1", "root")));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void backfillThreadStoresRepliesOnce() {
        when(chatClient.fetchReplies(CHANNEL, PARENT)).thenReturn(List.of(reply("151.000000"), reply("152.000000")));
        BackfillThreadWorker worker =
                new BackfillThreadWorker(chatClient, ingestionService, database.transactionTemplate(), Duration.ofSeconds(30));
        JobContext context = new JobContext(1L, 1, Instant.ofEpochSecond(500));

        worker.work(context, new BackfillThreadArgs(CHANNEL, PARENT.value()));
        worker.work(context, new BackfillThreadArgs(CHANNEL, PARENT.value()));

        assertEquals(2, store.listThreadMessages(CHANNEL, PARENT).size());
        assertEquals(Duration.ofSeconds(30), worker.nextRetry(7), "thread backfill retries on a fixed delay");
    }

    @Test
    void channelInfoRefreshUpdatesName() {
        when(chatClient.fetchChannelInfo(CHANNEL)).thenReturn(new ChannelInfo(CHANNEL, "renamed"));

        new ChannelInfoWorker(chatClient, store)
                .work(new JobContext(1L, 1, Instant.ofEpochSecond(500)), new ChannelInfoArgs(CHANNEL));

        assertEquals("renamed", store.findChannel(CHANNEL).orElseThrow().attributes().name());
    }

    private static ChatMessage reply(String ts) {
        return new ChatMessage(ts, "reply " + ts, "U2", null, null, null, PARENT.value(), 0, Map.of());
    }
}
