package com.williamcallahan.ratchet.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Verifies the versioned attribute bag stored alongside each message.
 */
class MessageAttributesTest {

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    @Test
    void writesSchemaVersionAndSnakeCaseFields() throws Exception {
        MessageAttributesV1 attributes = MessageAttributesV1.of(ChatMessage.of("101.000000", "U1", "db down"))
                .withIncidentAction(IncidentAction.open("db", "cpu", IncidentPriority.HIGH));

        JsonNode json = objectMapper.readTree(
                objectMapper.writerFor(MessageAttributes.class).writeValueAsString(attributes));

        assertEquals("1", json.path("schema_version").asText());
        assertEquals("open_incident", json.path("incident_action").path("action").asText());
        assertEquals("db down", json.path("message").path("text").asText());
    }

    @Test
    void readsDocumentsWithoutSchemaVersionAsVersionOne() throws Exception {
        String legacy = "{\"message\":{\"ts\":\"101.000000\",\"text\":\"hello\",\"user\":\"U1\"}}";

        MessageAttributes attributes = objectMapper.readValue(legacy, MessageAttributes.class);

        MessageAttributesV1 latest = assertInstanceOf(MessageAttributesV1.class, attributes).latest();
        assertEquals("hello", latest.text());
        assertNull(latest.incidentAction());
    }

    @Test
    void reactionDeltaRemovesReactionsThatReachZero() {
        MessageAttributesV1 attributes = new MessageAttributesV1(
                ChatMessage.of("1.0", "U1", "x"), Map.of("eyes", 1), null, null);

        MessageAttributesV1 added = attributes.withReactionDelta("fire", 1);
        MessageAttributesV1 removed = added.withReactionDelta("eyes", -1);

        assertEquals(2, added.reactions().size());
        assertFalse(removed.reactions().containsKey("eyes"));
        assertEquals(1, removed.reactions().get("fire"));
        assertTrue(removed.withReactionDelta("fire", -5).reactions().isEmpty(), "counts never go negative");
    }

    @Test
    void senderPrefersIntegrationUsername() {
        ChatMessage botPost = new ChatMessage("1.0", "alert", null, "B1", "pagerduty", "bot_message", null, 0, null);

        assertEquals("pagerduty", MessageAttributesV1.of(botPost).senderName());
        assertEquals("U1", MessageAttributesV1.of(ChatMessage.of("1.0", "U1", "x")).senderName());
    }
}
