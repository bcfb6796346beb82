package com.williamcallahan.ratchet.domain;

import java.util.Optional;

/**
 * Stored channel row.
 *
 * @param id Slack channel ID
 * @param attributes channel attribute bag
 * @param watermark newest timestamp committed by the ingestion loop, null until the first commit
 * @param enabled whether the ingestion loop should keep polling the channel
 */
public record ChannelRecord(String id, ChannelAttributes attributes, SlackTimestamp watermark, boolean enabled) {

    public Optional<SlackTimestamp> latestWatermark() {
        return Optional.ofNullable(watermark);
    }
}
