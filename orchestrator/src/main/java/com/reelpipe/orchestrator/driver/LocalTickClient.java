package com.reelpipe.orchestrator.driver;

import com.reelpipe.orchestrator.api.dto.JobResponse;
import com.reelpipe.orchestrator.api.dto.TickResponse;
import com.reelpipe.orchestrator.service.IllegalJobStateException;
import com.reelpipe.orchestrator.service.JobNotFoundException;
import com.reelpipe.orchestrator.service.JobService;
import com.reelpipe.orchestrator.service.TickController;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * In-process transport: calls the tick controller and job service directly.
 *
 * An unknown job or a refused transition ends the loop; any other error is
 * treated as transient (database hiccup, lock timeout) and retried.
 */
@Component
public class LocalTickClient implements TickClient {

    private final TickController tickController;
    private final JobService     jobService;

    public LocalTickClient(TickController tickController, JobService jobService) {
        this.tickController = tickController;
        this.jobService     = jobService;
    }

    @Override
    public TickResponse tick(UUID jobId, Integer maxItemsPerTick) {
        return call("tick", () -> TickResponse.from(tickController.tick(jobId, maxItemsPerTick)));
    }

    @Override
    public JobResponse pause(UUID jobId) {
        return call("pause", () -> JobResponse.from(jobService.pause(jobId)));
    }

    @Override
    public JobResponse resume(UUID jobId) {
        return call("resume", () -> JobResponse.from(jobService.resume(jobId)));
    }

    @Override
    public JobResponse stop(UUID jobId) {
        return call("stop", () -> JobResponse.from(jobService.stop(jobId)));
    }

    private static <T> T call(String op, Supplier<T> action) {
        try {
            return action.get();
        } catch (JobNotFoundException | IllegalJobStateException e) {
            throw new TickClientException(op + " refused: " + e.getMessage(), e, false);
        } catch (RuntimeException e) {
            throw new TickClientException(op + " failed: " + e.getMessage(), e, true);
        }
    }
}
