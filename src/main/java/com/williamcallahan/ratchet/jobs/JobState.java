package com.williamcallahan.ratchet.jobs;

import java.util.Locale;

public enum JobState {
    AVAILABLE,
    SCHEDULED,
    RUNNING,
    RETRYABLE,
    COMPLETED,
    DISCARDED;

    public String column() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobState fromColumn(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
