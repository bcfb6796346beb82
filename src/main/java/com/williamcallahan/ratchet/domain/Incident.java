package com.williamcallahan.ratchet.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Incident row. {@code endTimestamp}, {@code closeSlackTs} and {@code duration} are all null while
 * the incident is open and all set once it closes.
 */
public record Incident(
        long incidentId,
        String channelId,
        SlackTimestamp openSlackTs,
        String service,
        String alert,
        IncidentPriority priority,
        Instant startTimestamp,
        Instant endTimestamp,
        SlackTimestamp closeSlackTs,
        Duration duration) {

    public boolean isOpen() {
        return endTimestamp == null;
    }
}
