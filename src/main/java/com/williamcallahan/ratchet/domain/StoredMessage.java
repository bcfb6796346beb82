package com.williamcallahan.ratchet.domain;

/**
 * Top-level message row.
 *
 * @param channelId owning channel
 * @param ts message timestamp
 * @param attributes attribute bag, always upgraded to the newest schema
 * @param embedding embedding vector, null until classified
 */
public record StoredMessage(String channelId, SlackTimestamp ts, MessageAttributesV1 attributes, float[] embedding) {

    public boolean hasEmbedding() {
        return embedding != null;
    }
}
