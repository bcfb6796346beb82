package com.williamcallahan.ratchet.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Progress of the one-time history backfill for a channel.
 */
public enum OnboardingStatus {
    STARTED("started"),
    FINISHED("finished");

    private final String wireName;

    OnboardingStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
