package com.williamcallahan.ratchet.service.incident;

import com.williamcallahan.ratchet.domain.IncidentAction;
import com.williamcallahan.ratchet.domain.IncidentTag;
import com.williamcallahan.ratchet.domain.IncidentTransition;
import com.williamcallahan.ratchet.domain.MessageAttributesV1;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import com.williamcallahan.ratchet.domain.errors.NoOpenIncidentException;
import com.williamcallahan.ratchet.service.modules.MessageModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the classifier's open/close verdict to the incident state machine.
 */
public class IncidentModule implements MessageModule {
    private static final Logger log = LoggerFactory.getLogger(IncidentModule.class);

    private final IncidentStateMachine stateMachine;

    public IncidentModule(IncidentStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @Override
    public String name() {
        return "incident";
    }

    @Override
    public boolean enabledForBackfill() {
        return true;
    }

    @Override
    public void onMessage(String channelId, SlackTimestamp ts, MessageAttributesV1 attributes) {
        IncidentAction action = attributes.incidentAction();
        if (action == null || action.isNone()) {
            return;
        }
        if (isBlank(action.service()) || isBlank(action.alert())) {
            log.warn("[INCIDENT] Ignoring {} verdict for {} in {} without service and alert",
                    action.effectiveAction(), ts, channelId);
            return;
        }
        IncidentTag existing = attributes.incident();
        switch (action.effectiveAction()) {
            case OPEN_INCIDENT -> stateMachine.openIncident(channelId, ts, action);
            case CLOSE_INCIDENT -> {
                if (existing != null && existing.action() == IncidentTransition.CLOSE) {
                    log.debug("[INCIDENT] Message {} in {} already closed incident {}", ts, channelId, existing.incidentId());
                    return;
                }
                try {
                    stateMachine.closeIncident(channelId, ts, action);
                } catch (NoOpenIncidentException noMatch) {
                    log.warn("[INCIDENT] Ignoring close verdict: {}", noMatch.getMessage());
                }
            }
            default -> log.debug("[INCIDENT] No transition for {}", action.effectiveAction());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
