package com.williamcallahan.ratchet.chat;

import com.williamcallahan.ratchet.domain.ChatMessage;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import java.util.List;
import java.util.Map;

/**
 * Port to the chat platform.
 *
 * <p>Calls may throw {@link ChatRateLimitedException} when the platform throttles the bot and
 * {@link ChatApiException} for any other platform-reported failure.</p>
 */
public interface ChatClient {

    /**
     * Fetches one page of channel history.
     *
     * @param channelId channel to read
     * @param oldestExclusive only messages strictly newer than this are returned; null for the most recent messages
     * @param cursor continuation cursor from the previous page, null for the first page
     * @return messages in timestamp-ascending order plus the cursor of the next page
     */
    HistoryPage fetchHistory(String channelId, SlackTimestamp oldestExclusive, String cursor);

    /**
     * Fetches every reply of a thread, excluding the parent message.
     */
    List<ChatMessage> fetchReplies(String channelId, SlackTimestamp parentTs);

    ChannelInfo fetchChannelInfo(String channelId);

    /**
     * Posts a top-level message.
     *
     * @return timestamp of the posted message
     */
    String postMessage(String channelId, String text, List<Map<String, Object>> blocks);

    /**
     * Posts a reply into the thread rooted at {@code threadTs}.
     *
     * @return timestamp of the posted reply
     */
    String postThreadReply(String channelId, SlackTimestamp threadTs, String text);
}
