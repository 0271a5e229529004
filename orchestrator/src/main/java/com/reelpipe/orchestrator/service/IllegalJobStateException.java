package com.reelpipe.orchestrator.service;

/**
 * The requested action does not apply to the job's current state,
 * e.g. resuming a job that waits for an approval, or deciding on a stage
 * that is no longer pending. Mapped to HTTP 409.
 */
public class IllegalJobStateException extends RuntimeException {

    public IllegalJobStateException(String message) {
        super(message);
    }
}
