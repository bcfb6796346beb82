package com.williamcallahan.ratchet.service.classification;

/**
 * Signals that the classifier could not produce a verdict: it crashed, timed out, or printed something
 * other than a verdict.
 */
public class IncidentClassificationException extends RuntimeException {

    public IncidentClassificationException(String message) {
        super(message);
    }

    public IncidentClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
