package com.williamcallahan.ratchet.service.ingestion;

import com.williamcallahan.ratchet.jobs.InsertOptions;

/**
 * Where a batch of messages came from. Backfilled messages queue their follow-up work behind live ones.
 */
public enum MessageSource {
    LIVE(InsertOptions.defaults()),
    BACKFILL(InsertOptions.backfill());

    private final InsertOptions jobOptions;

    MessageSource(InsertOptions jobOptions) {
        this.jobOptions = jobOptions;
    }

    public InsertOptions jobOptions() {
        return jobOptions;
    }

    public boolean isBackfill() {
        return this == BACKFILL;
    }
}
