package com.williamcallahan.ratchet.jobs;

/**
 * Payload of a queued job. Implementations are JSON-serializable records; {@link #kind()} routes the
 * payload to the worker registered for it.
 */
public interface JobArgs {

    String kind();
}
