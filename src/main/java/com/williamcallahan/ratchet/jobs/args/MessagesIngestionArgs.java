package com.williamcallahan.ratchet.jobs.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.ratchet.jobs.JobArgs;

/**
 * One pass of the per-channel polling loop. At most one such job is pending per channel.
 */
public record MessagesIngestionArgs(@JsonProperty("channel_id") String channelId) implements JobArgs {
    public static final String KIND = "messages_ingestion";

    @Override
    public String kind() {
        return KIND;
    }
}
