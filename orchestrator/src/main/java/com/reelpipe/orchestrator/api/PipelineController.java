package com.reelpipe.orchestrator.api;

import com.reelpipe.orchestrator.api.dto.*;
import com.reelpipe.orchestrator.driver.EmbeddedDriver;
import com.reelpipe.orchestrator.model.Job;
import com.reelpipe.orchestrator.model.JobKind;
import com.reelpipe.orchestrator.service.ApprovalGate;
import com.reelpipe.orchestrator.service.JobService;
import com.reelpipe.orchestrator.service.Progress;
import com.reelpipe.orchestrator.service.TickController;
import com.reelpipe.orchestrator.service.TickResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * REST API for pipeline jobs.
 *
 * POST /jobs                       start a job (or return the active one)
 * POST /jobs/{id}/tick             run one bounded slice of work
 * GET  /jobs/{id}                  job, items and progress
 * GET  /jobs/latest                newest job for a project, for resume after reload
 * GET  /jobs/{id}/progress         counters and ETA
 * POST /jobs/{id}/pause|resume|stop|retry
 * POST /jobs/{id}/decisions        approve or reject the pending gate
 * POST /jobs/{id}/items/regen      regenerate selected items
 */
@RestController
@RequestMapping("/jobs")
public class PipelineController {

    private final JobService               jobService;
    private final TickController           tickController;
    private final ApprovalGate             approvalGate;
    private final Optional<EmbeddedDriver> driver;

    public PipelineController(JobService jobService,
                              TickController tickController,
                              ApprovalGate approvalGate,
                              Optional<EmbeddedDriver> driver) {
        this.jobService     = jobService;
        this.tickController = tickController;
        this.approvalGate   = approvalGate;
        this.driver         = driver;
    }

    /**
     * Start a job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"kind":"DOCUMENT_AUTORUN","projectRef":"proj-42","format":"documentary"}'
     */
    @PostMapping
    public ResponseEntity<StartJobResponse> start(@RequestBody StartJobRequest req) {
        Job job = jobService.start(req.toJobRequest());
        List<ItemResponse> items = items(job.getId());
        driver.ifPresent(d -> d.launch(job.getId()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new StartJobResponse(job.getId(), job.getTotalCount(), JobResponse.from(job), items));
    }

    @PostMapping("/{id}/tick")
    public TickResponse tick(@PathVariable UUID id, @RequestBody(required = false) TickRequest req) {
        TickResult result = tickController.tick(id, req == null ? null : req.maxItemsPerTick());
        return TickResponse.from(result);
    }

    @GetMapping("/{id}")
    public JobStatusResponse getJob(@PathVariable UUID id) {
        Job job = jobService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + id));
        return status(job);
    }

    /** Returns 404 when the project has never had a job (of this kind). */
    @GetMapping("/latest")
    public JobStatusResponse latest(@RequestParam String projectRef,
                                    @RequestParam(required = false) JobKind kind) {
        Job job = jobService.findLatest(projectRef, kind).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "No job for project " + projectRef));
        return status(job);
    }

    @GetMapping("/{id}/progress")
    public Progress progress(@PathVariable UUID id) {
        return jobService.progress(id);
    }

    @PostMapping("/{id}/pause")
    public JobResponse pause(@PathVariable UUID id) {
        return JobResponse.from(jobService.pause(id));
    }

    @PostMapping("/{id}/resume")
    public JobResponse resume(@PathVariable UUID id) {
        Job job = jobService.resume(id);
        driver.ifPresent(d -> d.launch(id));
        return JobResponse.from(job);
    }

    @PostMapping("/{id}/stop")
    public JobResponse stop(@PathVariable UUID id) {
        return JobResponse.from(jobService.stop(id));
    }

    @PostMapping("/{id}/retry")
    public JobResponse retry(@PathVariable UUID id) {
        Job job = jobService.retry(id);
        driver.ifPresent(d -> d.launch(id));
        return JobResponse.from(job);
    }

    /**
     * Approve or reject the stage the job is waiting at.
     * 409 if the job is not awaiting a decision for that stage.
     */
    @PostMapping("/{id}/decisions")
    public JobResponse decide(@PathVariable UUID id, @RequestBody DecisionRequest req) {
        if (req.stageKey() == null || req.stageKey().isBlank() || req.approved() == null) {
            throw new IllegalArgumentException("stageKey and approved are required");
        }
        Job job = approvalGate.decide(id, req.stageKey(), req.approved(), req.note());
        driver.ifPresent(d -> d.launch(id));
        return JobResponse.from(job);
    }

    @PostMapping("/{id}/items/regen")
    public JobResponse regenItems(@PathVariable UUID id, @RequestBody(required = false) RegenItemsRequest req) {
        Job job = jobService.regenItems(id, req == null ? null : req.itemIds());
        driver.ifPresent(d -> d.launch(id));
        return JobResponse.from(job);
    }

    private JobStatusResponse status(Job job) {
        return new JobStatusResponse(JobResponse.from(job), items(job.getId()), jobService.progress(job.getId()));
    }

    private List<ItemResponse> items(UUID jobId) {
        return jobService.getItems(jobId).stream()
                .map(ItemResponse::from)
                .toList();
    }
}
