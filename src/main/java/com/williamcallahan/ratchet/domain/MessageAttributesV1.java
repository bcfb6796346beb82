package com.williamcallahan.ratchet.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * First attribute schema: the raw message, live reaction counts, and whatever the classifier
 * and incident tracking later attached.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageAttributesV1(
        @JsonProperty("message") ChatMessage message,
        @JsonProperty("reactions") Map<String, Integer> reactions,
        @JsonProperty("incident_action") IncidentAction incidentAction,
        @JsonProperty("incident") IncidentTag incident) implements MessageAttributes {

    public MessageAttributesV1 {
        reactions = reactions == null ? Map.of() : Map.copyOf(reactions);
    }

    public static MessageAttributesV1 of(ChatMessage message) {
        Map<String, Integer> reactions = message == null ? Map.of() : message.reactions();
        return new MessageAttributesV1(message, reactions, null, null);
    }

    @Override
    public MessageAttributesV1 latest() {
        return this;
    }

    public MessageAttributesV1 withIncidentAction(IncidentAction action) {
        return new MessageAttributesV1(message, reactions, action, incident);
    }

    public MessageAttributesV1 withIncident(IncidentTag tag) {
        return new MessageAttributesV1(message, reactions, incidentAction, tag);
    }

    /**
     * Applies a reaction delta; counts never drop below zero and zeroed reactions disappear.
     */
    public MessageAttributesV1 withReactionDelta(String reaction, int delta) {
        Map<String, Integer> updated = new LinkedHashMap<>(reactions);
        int next = Math.max(0, updated.getOrDefault(reaction, 0) + delta);
        if (next == 0) {
            updated.remove(reaction);
        } else {
            updated.put(reaction, next);
        }
        return new MessageAttributesV1(message, updated, incidentAction, incident);
    }

    public String text() {
        return message == null || message.text() == null ? "" : message.text();
    }

    public String senderName() {
        return message == null ? "" : message.senderName();
    }
}
