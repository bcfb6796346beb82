package com.williamcallahan.ratchet.jobs.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.ratchet.jobs.JobArgs;

public record ChannelOnboardArgs(
        @JsonProperty("channel_id") String channelId,
        @JsonProperty("last_n_messages") int lastNMessages) implements JobArgs {
    public static final String KIND = "channel_onboard";

    @Override
    public String kind() {
        return KIND;
    }
}
