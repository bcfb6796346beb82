package com.williamcallahan.ratchet.jobs.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.ratchet.jobs.JobArgs;

/**
 * Fetch and store the replies of one thread.
 */
public record BackfillThreadArgs(
        @JsonProperty("channel_id") String channelId,
        @JsonProperty("slack_ts") String slackTs) implements JobArgs {
    public static final String KIND = "backfill_thread";

    @Override
    public String kind() {
        return KIND;
    }
}
