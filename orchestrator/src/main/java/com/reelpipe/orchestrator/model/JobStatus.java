package com.reelpipe.orchestrator.model;

/**
 * Lifecycle of a pipeline job.
 *
 * Transitions are forward-only except PAUSED ↔ RUNNING and FAILED → RUNNING
 * (explicit retry). Values are only ever added, never renamed, so jobs paused
 * across a deploy stay readable.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    PAUSED,
    STOPPED,
    COMPLETED,
    FAILED;

    /** A tick on a job in one of these states returns immediately with done=true. */
    public boolean haltsTicking() {
        return this == PAUSED || this == STOPPED || this == COMPLETED || this == FAILED;
    }

    /** Counts as "the" job for a project when deduplicating start requests. */
    public boolean isActive() {
        return this == QUEUED || this == RUNNING || this == PAUSED;
    }
}
