package com.reelpipe.orchestrator.service;

import com.reelpipe.orchestrator.model.JobKind;
import com.reelpipe.orchestrator.model.JobPolicy;

/** Everything needed to start a job. */
public record JobRequest(JobKind kind, String projectRef, String format, JobPolicy policy, PlanOptions options) {

    public JobRequest {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (projectRef == null || projectRef.isBlank()) {
            throw new IllegalArgumentException("projectRef is required");
        }
        policy  = policy == null ? JobPolicy.defaults() : policy;
        options = options == null ? PlanOptions.none() : options;
    }
}
