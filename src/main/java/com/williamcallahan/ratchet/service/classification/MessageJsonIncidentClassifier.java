package com.williamcallahan.ratchet.service.classification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.ratchet.domain.IncidentAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Development classifier: a message whose text is itself a verdict document
 * (for example {@code {"action":"open_incident","service":"api","alert":"5xx"}}) yields that verdict;
 * any other text yields {@code none}.
 */
public class MessageJsonIncidentClassifier implements IncidentClassifier {
    private static final Logger log = LoggerFactory.getLogger(MessageJsonIncidentClassifier.class);

    private final ObjectMapper objectMapper;

    public MessageJsonIncidentClassifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public IncidentAction classify(String sender, String text) {
        if (text == null || !text.trim().startsWith("{")) {
            return IncidentAction.none();
        }
        try {
            IncidentAction action = objectMapper.readValue(text, IncidentAction.class);
            return action == null ? IncidentAction.none() : action;
        } catch (JsonProcessingException notAVerdict) {
            log.debug("[CLASSIFY] Message from {} is not a verdict document: {}", sender, notAVerdict.getOriginalMessage());
            return IncidentAction.none();
        }
    }
}
