package com.williamcallahan.ratchet.service.incident;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.ratchet.domain.ChatMessage;
import com.williamcallahan.ratchet.domain.Incident;
import com.williamcallahan.ratchet.domain.IncidentAction;
import com.williamcallahan.ratchet.domain.IncidentPriority;
import com.williamcallahan.ratchet.domain.IncidentTag;
import com.williamcallahan.ratchet.domain.IncidentTransition;
import com.williamcallahan.ratchet.domain.MessageAttributesV1;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import com.williamcallahan.ratchet.domain.errors.NoOpenIncidentException;
import com.williamcallahan.ratchet.store.JdbcMessageStore;
import com.williamcallahan.ratchet.support.H2TestDatabase;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies incident open/close pairing and the message tags written with each transition.
 */
class IncidentStateMachineTest {

    private static final String CHANNEL = "C1";

    private H2TestDatabase database;
    private JdbcMessageStore store;
    private IncidentStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        database = H2TestDatabase.create();
        store = database.messageStore();
        stateMachine = new IncidentStateMachine(store, database.transactionTemplate());
        store.addChannel(CHANNEL);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void openingTwiceReturnsSameIncident() {
        storeMessage("100.000000");
        IncidentAction open = IncidentAction.open("db", "cpu", IncidentPriority.HIGH);

        long first = stateMachine.openIncident(CHANNEL, ts("100.000000"), open);
        long second = stateMachine.openIncident(CHANNEL, ts("100.000000"), open);

        assertEquals(first, second);
        assertEquals(1, store.listIncidents(CHANNEL).size());
        IncidentTag tag = store.findMessage(CHANNEL, ts("100.000000")).orElseThrow().attributes().incident();
        assertEquals(new IncidentTag(first, IncidentTransition.OPEN), tag);
    }

    @Test
    void closeRecordsExactDurationAndTagsMessage() {
        storeMessage("100.000000");
        storeMessage("160.500000");
        long id = stateMachine.openIncident(CHANNEL, ts("100.000000"), IncidentAction.open("db", "cpu", IncidentPriority.LOW));

        Incident closed = stateMachine.closeIncident(CHANNEL, ts("160.500000"), IncidentAction.close("db", "cpu"));

        assertEquals(id, closed.incidentId());
        assertEquals(Duration.ofMillis(60_500), closed.duration());
        assertEquals(ts("160.500000").toInstant(), closed.endTimestamp());
        assertEquals(new IncidentTag(id, IncidentTransition.CLOSE),
                store.findMessage(CHANNEL, ts("160.500000")).orElseThrow().attributes().incident());
    }

    @Test
    void closeWithoutOpenIncidentFailsAndWritesNothing() {
        storeMessage("160.000000");

        assertThrows(NoOpenIncidentException.class,
                () -> stateMachine.closeIncident(CHANNEL, ts("160.000000"), IncidentAction.close("db", "cpu")));

        assertTrue(store.listIncidents(CHANNEL).isEmpty());
        assertNull(store.findMessage(CHANNEL, ts("160.000000")).orElseThrow().attributes().incident());
    }

    @Test
    void closeIgnoresIncidentsOpenedAfterTheCloseMessage() {
        stateMachine.openIncident(CHANNEL, ts("200.000000"), IncidentAction.open("db", "cpu", IncidentPriority.HIGH));

        assertThrows(NoOpenIncidentException.class,
                () -> stateMachine.closeIncident(CHANNEL, ts("150.000000"), IncidentAction.close("db", "cpu")));
        assertTrue(store.listIncidents(CHANNEL).get(0).isOpen());
    }

    @Test
    void closePairsWithLatestOpenIncident() {
        IncidentAction open = IncidentAction.open("db", "cpu", IncidentPriority.HIGH);
        long older = stateMachine.openIncident(CHANNEL, ts("100.000000"), open);
        long newer = stateMachine.openIncident(CHANNEL, ts("120.000000"), open);

        Incident closed = stateMachine.closeIncident(CHANNEL, ts("130.000000"), IncidentAction.close("db", "cpu"));

        assertEquals(newer, closed.incidentId());
        assertTrue(store.findIncident(older).orElseThrow().isOpen(), "the older incident stays open");
    }

    @Test
    void closeMatchesOnServiceAndAlert() {
        stateMachine.openIncident(CHANNEL, ts("100.000000"), IncidentAction.open("db", "cpu", IncidentPriority.HIGH));

        assertThrows(NoOpenIncidentException.class,
                () -> stateMachine.closeIncident(CHANNEL, ts("130.000000"), IncidentAction.close("db", "disk")));

        List<Incident> incidents = store.listIncidents(CHANNEL);
        assertFalse(incidents.isEmpty());
        assertTrue(incidents.get(0).isOpen());
    }

    @Test
    void transitionsRequireServiceAndAlert() {
        assertThrows(IllegalArgumentException.class,
                () -> stateMachine.openIncident(CHANNEL, ts("1.000000"), IncidentAction.open("db", " ", IncidentPriority.LOW)));
        assertThrows(IllegalArgumentException.class,
                () -> stateMachine.closeIncident(CHANNEL, ts("1.000000"), IncidentAction.close(null, "cpu")));
    }

    private void storeMessage(String ts) {
        store.insertMessage(CHANNEL, ts(ts), MessageAttributesV1.of(ChatMessage.of(ts, "U1", "alert " + ts)));
    }

    private static SlackTimestamp ts(String value) {
        return SlackTimestamp.parse(value);
    }
}
