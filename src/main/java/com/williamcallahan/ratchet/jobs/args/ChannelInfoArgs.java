package com.williamcallahan.ratchet.jobs.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.ratchet.jobs.JobArgs;

public record ChannelInfoArgs(@JsonProperty("channel_id") String channelId) implements JobArgs {
    public static final String KIND = "channel_info";

    @Override
    public String kind() {
        return KIND;
    }
}
