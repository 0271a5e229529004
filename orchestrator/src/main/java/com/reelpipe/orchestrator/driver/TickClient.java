package com.reelpipe.orchestrator.driver;

import com.reelpipe.orchestrator.api.dto.JobResponse;
import com.reelpipe.orchestrator.api.dto.TickResponse;

import java.util.UUID;

/**
 * Transport a {@link RunLoop} drives a job through.
 *
 * {@link LocalTickClient} calls the services in-process;
 * {@link PipelineApiClient} calls a remote orchestrator over HTTP.
 * All methods throw {@link TickClientException}.
 */
public interface TickClient {

    /** @param maxItemsPerTick null uses the job policy */
    TickResponse tick(UUID jobId, Integer maxItemsPerTick);

    JobResponse pause(UUID jobId);

    JobResponse resume(UUID jobId);

    JobResponse stop(UUID jobId);
}
