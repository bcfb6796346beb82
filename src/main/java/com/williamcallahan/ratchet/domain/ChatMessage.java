package com.williamcallahan.ratchet.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * A message as delivered by the chat platform, persisted verbatim inside the message attribute bag.
 *
 * @param ts message timestamp, unique within its channel
 * @param text message text
 * @param user posting user ID, absent for bot posts
 * @param botId posting bot ID, absent for human posts
 * @param username display name supplied by bots and integrations
 * @param subtype platform subtype such as {@code bot_message}
 * @param threadTs parent timestamp when the message belongs to a thread
 * @param replyCount number of thread replies known at fetch time
 * @param reactions reaction name to count as reported by the platform
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(
        @JsonProperty("ts") String ts,
        @JsonProperty("text") String text,
        @JsonProperty("user") String user,
        @JsonProperty("bot_id") String botId,
        @JsonProperty("username") String username,
        @JsonProperty("subtype") String subtype,
        @JsonProperty("thread_ts") String threadTs,
        @JsonProperty("reply_count") int replyCount,
        @JsonProperty("reactions") Map<String, Integer> reactions) {

    public ChatMessage {
        reactions = reactions == null ? Map.of() : Map.copyOf(reactions);
    }

    public static ChatMessage of(String ts, String user, String text) {
        return new ChatMessage(ts, text, user, null, null, null, null, 0, Map.of());
    }

    @JsonIgnore
    public SlackTimestamp timestamp() {
        return SlackTimestamp.parse(ts);
    }

    /**
     * Name handed to the classifier: the integration's display name, else the user, else the bot.
     */
    @JsonIgnore
    public String senderName() {
        if (username != null && !username.isBlank()) {
            return username;
        }
        if (user != null && !user.isBlank()) {
            return user;
        }
        return botId == null ? "" : botId;
    }

    @JsonIgnore
    public boolean hasReplies() {
        return replyCount > 0;
    }

    /** Thread replies carry a {@code thread_ts} distinct from their own timestamp. */
    @JsonIgnore
    public boolean isThreadReply() {
        return threadTs != null && !threadTs.isBlank() && !threadTs.equals(ts);
    }
}
