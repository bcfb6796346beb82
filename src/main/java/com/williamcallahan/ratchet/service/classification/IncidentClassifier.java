package com.williamcallahan.ratchet.service.classification;

import com.williamcallahan.ratchet.domain.IncidentAction;

/**
 * Decides whether a message opens an incident, closes one, or neither.
 */
public interface IncidentClassifier {

    /**
     * @param sender display name of the poster
     * @param text message text
     * @return the verdict, never null
     * @throws IncidentClassificationException when no verdict could be produced
     */
    IncidentAction classify(String sender, String text);
}
