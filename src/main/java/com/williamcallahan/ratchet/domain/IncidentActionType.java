package com.williamcallahan.ratchet.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Incident verdict produced by the classifier.
 */
public enum IncidentActionType {
    @JsonProperty("none")
    NONE,
    @JsonProperty("open_incident")
    OPEN_INCIDENT,
    @JsonProperty("close_incident")
    CLOSE_INCIDENT
}
