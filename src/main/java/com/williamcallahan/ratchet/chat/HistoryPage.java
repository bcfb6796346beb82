package com.williamcallahan.ratchet.chat;

import com.williamcallahan.ratchet.domain.ChatMessage;
import java.util.List;

/**
 * @param messages page contents, oldest first
 * @param nextCursor cursor for the following page, null on the last page
 */
public record HistoryPage(List<ChatMessage> messages, String nextCursor) {

    public HistoryPage {
        messages = messages == null ? List.of() : List.copyOf(messages);
        nextCursor = nextCursor == null || nextCursor.isBlank() ? null : nextCursor;
    }

    public static HistoryPage last(List<ChatMessage> messages) {
        return new HistoryPage(messages, null);
    }

    public boolean hasMore() {
        return nextCursor != null;
    }
}
