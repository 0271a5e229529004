package com.reelpipe.orchestrator.driver;

/**
 * A run loop could not get an answer from the tick endpoint.
 *
 * Transient failures (connection refused, timeout, 5xx) are retried by
 * the run loop; anything else ends it.
 */
public class TickClientException extends RuntimeException {

    private final boolean transientFailure;

    public TickClientException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public TickClientException(String message, boolean transientFailure) {
        this(message, null, transientFailure);
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
