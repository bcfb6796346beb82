package com.williamcallahan.ratchet.domain.errors;

/**
 * Signals a close verdict with no matching open incident. The store is left unchanged.
 */
public class NoOpenIncidentException extends RuntimeException {

    /**
     * @param channelId channel the close message was posted in
     * @param service service named by the close verdict
     * @param alert alert named by the close verdict
     * @param closeTs timestamp of the close message
     */
    public NoOpenIncidentException(String channelId, String service, String alert, String closeTs) {
        super("No open incident for service=" + service + " alert=" + alert
                + " in channel " + channelId + " before " + closeTs);
    }
}
