package com.williamcallahan.ratchet.chat;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.ratchet.domain.ChatMessage;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Message object as it appears in Slack history responses and message events.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackMessagePayload(
        @JsonProperty("ts") String ts,
        @JsonProperty("text") String text,
        @JsonProperty("user") String user,
        @JsonProperty("bot_id") String botId,
        @JsonProperty("username") String username,
        @JsonProperty("subtype") String subtype,
        @JsonProperty("thread_ts") String threadTs,
        @JsonProperty("reply_count") Integer replyCount,
        @JsonProperty("reactions") List<Reaction> reactions) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Reaction(@JsonProperty("name") String name, @JsonProperty("count") int count) {}

    public ChatMessage toChatMessage() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (reactions != null) {
            for (Reaction reaction : reactions) {
                if (reaction.name() != null && reaction.count() > 0) {
                    counts.put(reaction.name(), reaction.count());
                }
            }
        }
        return new ChatMessage(
                ts, text, user, botId, username, subtype, threadTs, replyCount == null ? 0 : replyCount, counts);
    }
}
