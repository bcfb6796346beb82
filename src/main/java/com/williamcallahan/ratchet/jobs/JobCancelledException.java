package com.williamcallahan.ratchet.jobs;

/**
 * Thrown from inside a job body once its deadline elapsed or the runner is shutting down.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(String message) {
        super(message);
    }
}
