package com.williamcallahan.ratchet.service;

/**
 * Embedding port used to index classified messages.
 */
public interface EmbeddingClient {

    /**
     * Produces a dense embedding vector for one message text.
     *
     * @param text input text
     * @return embedding vector of {@link #dimensions()} values
     * @throws EmbeddingServiceUnavailableException when the provider fails or returns an unusable vector
     */
    float[] embed(String text);

    int dimensions();
}
