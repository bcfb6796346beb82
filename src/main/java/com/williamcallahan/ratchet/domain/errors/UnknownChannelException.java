package com.williamcallahan.ratchet.domain.errors;

/**
 * Signals a write or watermark operation against a channel that was never registered.
 */
public class UnknownChannelException extends RuntimeException {
    private final String channelId;

    /**
     * @param channelId channel that has no stored row
     */
    public UnknownChannelException(String channelId) {
        super("Unknown channel: " + channelId);
        this.channelId = channelId;
    }

    /**
     * @param channelId channel that has no stored row
     * @param cause constraint violation reported by the database
     */
    public UnknownChannelException(String channelId, Throwable cause) {
        super("Unknown channel: " + channelId, cause);
        this.channelId = channelId;
    }

    public String getChannelId() {
        return channelId;
    }
}
