package com.williamcallahan.ratchet.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IncidentTransition {
    OPEN("open"),
    CLOSE("close");

    private final String wireName;

    IncidentTransition(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
