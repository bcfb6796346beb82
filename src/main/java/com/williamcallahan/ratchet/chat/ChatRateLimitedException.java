package com.williamcallahan.ratchet.chat;

import java.time.Duration;

/**
 * Signals that the platform throttled the call. The job that made it fails its attempt and is retried
 * on its normal schedule.
 */
public class ChatRateLimitedException extends ChatApiException {
    private final Duration retryAfter;

    public ChatRateLimitedException(String method, Duration retryAfter) {
        super("Rate limited calling " + method + (retryAfter == null ? "" : "; retry after " + retryAfter));
        this.retryAfter = retryAfter;
    }

    /** Server-suggested wait, or null when none was given. */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
