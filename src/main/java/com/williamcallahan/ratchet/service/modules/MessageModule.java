package com.williamcallahan.ratchet.service.modules;

import com.williamcallahan.ratchet.domain.MessageAttributesV1;
import com.williamcallahan.ratchet.domain.SlackTimestamp;

/**
 * Hook run against every classified message, in registration order.
 */
public interface MessageModule {

    String name();

    /**
     * Whether the module also runs for messages replayed from history.
     */
    boolean enabledForBackfill();

    /**
     * @param channelId channel of the message
     * @param ts message timestamp
     * @param attributes stored attributes including the classifier verdict
     */
    void onMessage(String channelId, SlackTimestamp ts, MessageAttributesV1 attributes);
}
