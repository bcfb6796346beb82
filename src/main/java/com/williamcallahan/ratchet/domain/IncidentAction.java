package com.williamcallahan.ratchet.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import java.time.Duration;

/**
 * Classifier output for one message.
 *
 * @param action verdict, treated as {@link IncidentActionType#NONE} when absent
 * @param alert alert identifier, required for open and close
 * @param service affected service, required for open and close
 * @param priority optional severity
 * @param duration optional duration hint reported by the classifier
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncidentAction(
        @JsonProperty("action") IncidentActionType action,
        @JsonProperty("alert") String alert,
        @JsonProperty("service") String service,
        @JsonProperty("priority") IncidentPriority priority,
        @JsonProperty("duration")
                @JsonSerialize(using = ToStringSerializer.class)
                @JsonDeserialize(using = FlexibleDurationDeserializer.class)
                Duration duration) {

    public static IncidentAction none() {
        return new IncidentAction(IncidentActionType.NONE, null, null, null, null);
    }

    public static IncidentAction open(String service, String alert, IncidentPriority priority) {
        return new IncidentAction(IncidentActionType.OPEN_INCIDENT, alert, service, priority, null);
    }

    public static IncidentAction close(String service, String alert) {
        return new IncidentAction(IncidentActionType.CLOSE_INCIDENT, alert, service, null, null);
    }

    @JsonIgnore
    public IncidentActionType effectiveAction() {
        return action == null ? IncidentActionType.NONE : action;
    }

    @JsonIgnore
    public boolean isNone() {
        return effectiveAction() == IncidentActionType.NONE;
    }
}
