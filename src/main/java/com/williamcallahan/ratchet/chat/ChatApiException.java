package com.williamcallahan.ratchet.chat;

/**
 * Signals a failed chat platform call.
 */
public class ChatApiException extends RuntimeException {

    /**
     * @param message explanation including the platform's error code when one was returned
     */
    public ChatApiException(String message) {
        super(message);
    }

    /**
     * @param message explanation of the failure
     * @param cause transport or decoding failure
     */
    public ChatApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
