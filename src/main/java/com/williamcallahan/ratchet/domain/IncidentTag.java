package com.williamcallahan.ratchet.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Marker written onto a message that opened or closed an incident.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncidentTag(
        @JsonProperty("incident_id") long incidentId,
        @JsonProperty("action") IncidentTransition action) {}
