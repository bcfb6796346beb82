package com.williamcallahan.ratchet.service;

/**
 * Signals that the embedding provider is unavailable or returned an invalid response.
 *
 * <p>Raised instead of storing a partial or synthetic vector; the classification job fails its attempt
 * and the queue retries it.</p>
 */
public class EmbeddingServiceUnavailableException extends RuntimeException {

    /**
     * @param message explanation of the embedding failure
     */
    public EmbeddingServiceUnavailableException(String message) {
        super(message);
    }

    /**
     * @param message explanation of the embedding failure
     * @param cause underlying exception from the provider call
     */
    public EmbeddingServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
