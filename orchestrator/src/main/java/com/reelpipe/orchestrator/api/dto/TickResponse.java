package com.reelpipe.orchestrator.api.dto;

import com.reelpipe.orchestrator.service.TickResult;

public record TickResponse(boolean done, boolean blocked, JobResponse job, int processedCount) {

    public static TickResponse from(TickResult result) {
        return new TickResponse(result.done(), result.blocked(), JobResponse.from(result.job()), result.processedCount());
    }
}
