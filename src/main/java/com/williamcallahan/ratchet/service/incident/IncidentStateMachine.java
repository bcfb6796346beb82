package com.williamcallahan.ratchet.service.incident;

import com.williamcallahan.ratchet.domain.Incident;
import com.williamcallahan.ratchet.domain.IncidentAction;
import com.williamcallahan.ratchet.domain.IncidentTag;
import com.williamcallahan.ratchet.domain.IncidentTransition;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import com.williamcallahan.ratchet.domain.errors.NoOpenIncidentException;
import com.williamcallahan.ratchet.store.MessageStore;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Opens and closes incidents from classifier verdicts.
 *
 * <p>An incident is identified by (channel, service, alert, opening message). A close verdict closes the
 * most recently opened incident for the same (channel, service, alert) that opened strictly before the
 * closing message and is still open. Each transition commits together with the tag on the message that
 * caused it.</p>
 */
public class IncidentStateMachine {
    private static final Logger log = LoggerFactory.getLogger(IncidentStateMachine.class);

    private static final int MAX_CLOSE_ATTEMPTS = 3;

    private final MessageStore store;
    private final TransactionTemplate transactionTemplate;

    public IncidentStateMachine(MessageStore store, TransactionTemplate transactionTemplate) {
        this.store = Objects.requireNonNull(store, "store");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
    }

    /**
     * Opens an incident for the message at {@code openTs}. Opening the same key again returns the
     * existing incident's ID and leaves the store unchanged.
     *
     * @return the incident ID
     */
    public long openIncident(String channelId, SlackTimestamp openTs, IncidentAction action) {
        requireIdentity(action);
        Long incidentId = transactionTemplate.execute(status -> {
            Optional<Long> created = store.insertIncident(
                    channelId, openTs, action.service(), action.alert(), action.priority());
            if (created.isEmpty()) {
                long existing = store.findIncidentByKey(channelId, action.service(), action.alert(), openTs)
                        .map(Incident::incidentId)
                        .orElseThrow(() -> new IllegalStateException("Incident insert conflicted but no row matches "
                                + channelId + "/" + action.service() + "/" + action.alert() + "/" + openTs));
                log.debug("[INCIDENT] Open for {}/{} at {} already recorded as {}",
                        action.service(), action.alert(), openTs, existing);
                return existing;
            }
            long id = created.get();
            if (!store.tagMessage(channelId, openTs, new IncidentTag(id, IncidentTransition.OPEN))) {
                log.warn("[INCIDENT] Opened incident {} but message {} in {} is not stored; left untagged", id, openTs, channelId);
            }
            log.info("[INCIDENT] Opened incident {} service={} alert={} priority={} channel={}",
                    id, action.service(), action.alert(), action.priority(), channelId);
            return id;
        });
        return Objects.requireNonNull(incidentId, "incidentId");
    }

    /**
     * Closes the matching open incident for the message at {@code closeTs}.
     *
     * @return the closed incident
     * @throws NoOpenIncidentException when no incident matches; nothing is written in that case
     */
    public Incident closeIncident(String channelId, SlackTimestamp closeTs, IncidentAction action) {
        requireIdentity(action);
        Instant closedAt = closeTs.toInstant();
        Incident closed = transactionTemplate.execute(status -> {
            for (int attempt = 1; attempt <= MAX_CLOSE_ATTEMPTS; attempt++) {
                Incident candidate = store.findLatestOpenIncidentBefore(
                                channelId, action.service(), action.alert(), closedAt)
                        .orElseThrow(() -> new NoOpenIncidentException(
                                channelId, action.service(), action.alert(), closeTs.value()));
                Duration duration = Duration.between(candidate.startTimestamp(), closedAt);
                if (store.closeIncident(candidate.incidentId(), closeTs, closedAt, duration)) {
                    store.tagMessage(channelId, closeTs, new IncidentTag(candidate.incidentId(), IncidentTransition.CLOSE));
                    log.info("[INCIDENT] Closed incident {} service={} alert={} after {}",
                            candidate.incidentId(), action.service(), action.alert(), duration);
                    return store.findIncident(candidate.incidentId()).orElseThrow();
                }
                log.debug("[INCIDENT] Incident {} closed concurrently; re-resolving", candidate.incidentId());
            }
            throw new NoOpenIncidentException(channelId, action.service(), action.alert(), closeTs.value());
        });
        return Objects.requireNonNull(closed, "closed");
    }

    private static void requireIdentity(IncidentAction action) {
        if (action == null || isBlank(action.service()) || isBlank(action.alert())) {
            throw new IllegalArgumentException("Incident transitions require both service and alert");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
