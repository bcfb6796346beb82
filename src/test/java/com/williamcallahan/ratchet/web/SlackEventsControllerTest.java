package com.williamcallahan.ratchet.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.ratchet.domain.ChatMessage;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import com.williamcallahan.ratchet.jobs.InsertOptions;
import com.williamcallahan.ratchet.jobs.JobQueue;
import com.williamcallahan.ratchet.jobs.args.ChannelInfoArgs;
import com.williamcallahan.ratchet.service.ingestion.MessageIngestionService;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Drives the Slack events endpoint through MockMvc with signed requests.
 */
class SlackEventsControllerTest {
    private static final String SECRET = "test-signing-secret";
    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

    private SlackRequestVerifier verifier;
    private MessageIngestionService ingestionService;
    private JobQueue jobQueue;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        verifier = new SlackRequestVerifier(SECRET, Clock.fixed(NOW, ZoneOffset.UTC));
        ingestionService = mock(MessageIngestionService.class);
        jobQueue = mock(JobQueue.class);
        SlackEventsController controller = new SlackEventsController(
                verifier, ingestionService, jobQueue, new ObjectMapper(), new ExceptionResponseBuilder());
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void urlVerificationEchoesChallenge() throws Exception {
        mockMvc.perform(signed("{\"type\":\"url_verification\",\"challenge\":\"3eZbrw1aBm2rZgRNFdxV2595E9CY3gmdALWMmHkvFXO7tYXAYM8P\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.challenge").value("3eZbrw1aBm2rZgRNFdxV2595E9CY3gmdALWMmHkvFXO7tYXAYM8P"));
    }

    @Test
    void messageEventIsRecordedAsLiveMessage() throws Exception {
        when(ingestionService.recordLiveMessage(eq("C1"), any())).thenReturn(true);

        mockMvc.perform(signed("""
                        {"type": "event_callback",
                         "event": {"type": "message", "channel": "C1", "ts": "1700000000.000100",
                                   "username": "PagerDuty", "bot_id": "B1", "subtype": "bot_message",
                                   "text": "Triggered: db cpu high"}}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));

        ArgumentCaptor<ChatMessage> message = ArgumentCaptor.forClass(ChatMessage.class);
        verify(ingestionService).recordLiveMessage(eq("C1"), message.capture());
        assertEquals("1700000000.000100", message.getValue().ts());
        assertEquals("PagerDuty", message.getValue().senderName());
        assertEquals("Triggered: db cpu high", message.getValue().text());
    }

    @Test
    void editedMessagesAreIgnored() throws Exception {
        mockMvc.perform(signed("""
                        {"type": "event_callback",
                         "event": {"type": "message", "subtype": "message_changed", "channel": "C1",
                                   "ts": "1700000000.000200"}}
                        """))
                .andExpect(status().isOk());

        verifyNoInteractions(ingestionService);
    }

    @Test
    void reactionEventsAdjustCounts() throws Exception {
        mockMvc.perform(signed("""
                        {"type": "event_callback",
                         "event": {"type": "reaction_added", "reaction": "eyes",
                                   "item": {"type": "message", "channel": "C1", "ts": "1700000000.000100"}}}
                        """))
                .andExpect(status().isOk());
        mockMvc.perform(signed("""
                        {"type": "event_callback",
                         "event": {"type": "reaction_removed", "reaction": "eyes",
                                   "item": {"type": "message", "channel": "C1", "ts": "1700000000.000100"}}}
                        """))
                .andExpect(status().isOk());

        SlackTimestamp ts = SlackTimestamp.parse("1700000000.000100");
        verify(ingestionService).recordReaction("C1", ts, "eyes", 1);
        verify(ingestionService).recordReaction("C1", ts, "eyes", -1);
    }

    @Test
    void channelRenameQueuesInfoRefresh() throws Exception {
        when(jobQueue.enqueue(any(), any())).thenReturn(Optional.of(1L));

        mockMvc.perform(signed("""
                        {"type": "event_callback",
                         "event": {"type": "channel_rename", "channel": {"id": "C1", "name": "ops-alerts"}}}
                        """))
                .andExpect(status().isOk());

        verify(jobQueue).enqueue(new ChannelInfoArgs("C1"), InsertOptions.defaults().uniqueBy("C1"));
    }

    @Test
    void badSignatureIsRejected() throws Exception {
        mockMvc.perform(post("/slack/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Slack-Request-Timestamp", Long.toString(NOW.getEpochSecond()))
                        .header("X-Slack-Signature", "v0=deadbeef")
                        .content("{\"type\":\"url_verification\",\"challenge\":\"x\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value("error"));

        verifyNoInteractions(ingestionService, jobQueue);
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(signed("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed event body"));
    }

    @Test
    void messageWithoutChannelIsBadRequest() throws Exception {
        mockMvc.perform(signed("""
                        {"type": "event_callback", "event": {"type": "message", "ts": "1700000000.000100"}}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Event is missing 'channel'"));
    }

    private MockHttpServletRequestBuilder signed(String body) {
        String timestamp = Long.toString(NOW.getEpochSecond());
        return post("/slack/events")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Slack-Request-Timestamp", timestamp)
                .header("X-Slack-Signature", verifier.sign(timestamp, body))
                .content(body);
    }
}
