package com.reelpipe.orchestrator.service;

import com.reelpipe.orchestrator.model.Job;

/**
 * @param done           true iff the job is completed, failed, paused or stopped
 * @param blocked        true while the job waits for an approval decision
 * @param job            job state after the tick
 * @param processedCount items claimed and executed by this tick
 */
public record TickResult(boolean done, boolean blocked, Job job, int processedCount) {

    public static TickResult of(Job job, int processedCount) {
        return new TickResult(job.getStatus().haltsTicking(), job.isAwaitingApproval(), job, processedCount);
    }
}
