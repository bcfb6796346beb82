package com.williamcallahan.ratchet.domain.errors;

public class MessageNotFoundException extends RuntimeException {

    public MessageNotFoundException(String channelId, String ts) {
        super("Message " + ts + " not found in channel " + channelId);
    }
}
