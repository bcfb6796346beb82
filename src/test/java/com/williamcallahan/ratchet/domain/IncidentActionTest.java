package com.williamcallahan.ratchet.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Verifies decoding of classifier verdict documents.
 */
class IncidentActionTest {

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    @Test
    void decodesOpenVerdict() throws Exception {
        IncidentAction action = objectMapper.readValue(
                "{\"action\":\"open_incident\",\"service\":\"db\",\"alert\":\"cpu\",\"priority\":\"HIGH\"}",
                IncidentAction.class);

        assertEquals(IncidentActionType.OPEN_INCIDENT, action.effectiveAction());
        assertEquals("db", action.service());
        assertEquals(IncidentPriority.HIGH, action.priority());
        assertNull(action.duration());
    }

    @Test
    void missingActionMeansNone() throws Exception {
        IncidentAction action = objectMapper.readValue("{\"service\":\"db\"}", IncidentAction.class);

        assertTrue(action.isNone());
    }

    @Test
    void acceptsDurationsAsNanosIsoOrUnitText() throws Exception {
        assertEquals(Duration.ofSeconds(2), durationOf("2000000000"));
        assertEquals(Duration.ofMinutes(90), durationOf("\"PT1H30M\""));
        assertEquals(Duration.ofMinutes(90), durationOf("\"1h30m\""));
        assertEquals(Duration.ofMillis(250), durationOf("\"250ms\""));
    }

    @Test
    void rejectsUnparseableDuration() {
        assertThrows(InvalidFormatException.class, () -> durationOf("\"soon\""));
    }

    private Duration durationOf(String durationJson) throws Exception {
        return objectMapper.readValue(
                "{\"action\":\"close_incident\",\"duration\":" + durationJson + "}", IncidentAction.class).duration();
    }
}
