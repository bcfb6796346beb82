package com.williamcallahan.ratchet.domain;

public record ThreadMessageRecord(String channelId, SlackTimestamp parentTs, SlackTimestamp ts, MessageAttributesV1 attributes) {}
