package com.williamcallahan.ratchet.web;

/**
 * Signals an event request whose signature is missing, stale, or wrong.
 */
public class InvalidSlackSignatureException extends RuntimeException {

    public InvalidSlackSignatureException(String message) {
        super(message);
    }
}
