package com.williamcallahan.ratchet.jobs.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.ratchet.jobs.JobArgs;

/**
 * Classify one stored message.
 *
 * @param backfill true when the message came from history replay rather than live traffic
 */
public record ClassifierArgs(
        @JsonProperty("channel_id") String channelId,
        @JsonProperty("slack_ts") String slackTs,
        @JsonProperty("is_backfill") boolean backfill) implements JobArgs {
    public static final String KIND = "classifier";

    @Override
    public String kind() {
        return KIND;
    }
}
