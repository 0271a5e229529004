package com.reelpipe.orchestrator.service;

import com.reelpipe.orchestrator.claim.ClaimProtocol;
import com.reelpipe.orchestrator.model.Item;
import com.reelpipe.orchestrator.model.ItemStatus;
import com.reelpipe.orchestrator.model.Job;
import com.reelpipe.orchestrator.model.JobStatus;
import com.reelpipe.orchestrator.repository.ItemRepository;
import com.reelpipe.orchestrator.repository.JobRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One bounded slice of work on a job.
 *
 * A tick holds no state between calls and takes no job-wide lock while items
 * execute, so any number of callers may tick the same job at once: each item
 * is claimed through ClaimProtocol, and a caller that loses a claim simply
 * moves on. Wall-clock time per tick is bounded by maxItemsPerTick times the
 * generation timeout.
 *
 * Not @Transactional: every claim and result write commits on its own, and a
 * crash mid-tick leaves at most one lease to expire.
 */
@Service
public class TickController {

    private static final Logger log = LoggerFactory.getLogger(TickController.class);

    // Extra candidates fetched beyond the limit, for claims lost to concurrent callers.
    private static final int CANDIDATE_SLACK = 4;

    private final JobRepository  jobRepo;
    private final ItemRepository itemRepo;
    private final JobService     jobService;
    private final ClaimProtocol  claims;
    private final StepExecutor   executor;
    private final ApprovalGate   approvalGate;
    private final Clock          clock;
    private final MeterRegistry  meterRegistry;

    public TickController(JobRepository jobRepo,
                          ItemRepository itemRepo,
                          JobService jobService,
                          ClaimProtocol claims,
                          StepExecutor executor,
                          ApprovalGate approvalGate,
                          Clock clock,
                          MeterRegistry meterRegistry) {
        this.jobRepo       = jobRepo;
        this.itemRepo      = itemRepo;
        this.jobService    = jobService;
        this.claims        = claims;
        this.executor      = executor;
        this.approvalGate  = approvalGate;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Steps:
     *  1. Paused, stopped, completed or failed job → return at once, no writes
     *  2. QUEUED → RUNNING (first tick only)
     *  3. Fail leases that expired on their last allowed attempt, and open the
     *     approval request of any finished gated item whose caller never did
     *  4. Claim and execute up to maxItemsPerTick items in index order, never
     *     past an undecided approval gate; re-read the job status between items
     *  5. Recompute counters and completion from item rows
     *
     * @param maxItemsPerTick null or &lt;= 0 uses the job policy
     */
    public TickResult tick(UUID jobId, Integer maxItemsPerTick) {
        Job job = jobService.getJob(jobId);
        if (job.getStatus().haltsTicking()) {
            log.debug("Job {} is {}; tick is a no-op", jobId, job.getStatus());
            return TickResult.of(job, 0);
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Instant now = clock.instant();
            if (jobRepo.markRunningIfQueued(jobId, now) == 1) {
                log.info("Job {} RUNNING ({} items)", jobId, job.getTotalCount());
            }
            int expired = itemRepo.expireAbandoned(jobId, claims.maxAttempts(), now);
            if (expired > 0) {
                log.warn("Job {}: failed {} item(s) whose lease expired on the last attempt", jobId, expired);
            }

            requestUndecidedGates(jobId);

            int limit   = (maxItemsPerTick == null || maxItemsPerTick <= 0)
                    ? job.getPolicy().getMaxItemsPerTick() : maxItemsPerTick;
            String owner = "tick-" + UUID.randomUUID().toString().substring(0, 8);
            int barrier  = itemRepo.findGateBarrier(jobId).orElse(Integer.MAX_VALUE);
            List<Item> candidates = itemRepo.findClaimCandidates(
                    jobId, barrier, claims.maxAttempts(), now, limit + CANDIDATE_SLACK);

            int processed = 0;
            for (Item candidate : candidates) {
                if (processed >= limit) {
                    break;
                }
                // Cooperative pause/stop: checked before every claim.
                if (jobService.currentStatus(jobId) != JobStatus.RUNNING) {
                    break;
                }
                if (!claims.claimItem(candidate, owner)) {
                    continue;
                }
                processed++;
                if (runClaimed(job, candidate, owner) == Flow.HALT) {
                    break;
                }
            }

            Job after = jobService.refreshProgress(jobId);
            log.debug("Job {} tick by {}: processed={}, status={}, completed={}/{}",
                    jobId, owner, processed, after.getStatus(), after.getCompletedCount(), after.getTotalCount());
            return TickResult.of(after, processed);
        } finally {
            sample.stop(meterRegistry.timer("reelpipe.tick.duration", "kind", job.getKind().name()));
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private enum Flow { CONTINUE, HALT }

    /** Execute an item this caller holds the lease on and write the result back, fenced by owner. */
    private Flow runClaimed(Job job, Item item, String owner) {
        MDC.put("jobId",    job.getId().toString());
        MDC.put("itemId",   item.getId().toString());
        MDC.put("stageKey", item.getUnitKey());
        MDC.put("attempt",  String.valueOf(item.getAttempts() + 1));
        try {
            ExecutionOutcome outcome;
            try {
                outcome = executor.execute(job, item, owner);
            } catch (RuntimeException e) {
                log.error("Unhandled error executing item {}: {}", item.getId(), e.getMessage(), e);
                outcome = ExecutionOutcome.failed("unhandled error: " + e.getMessage());
            }
            meterRegistry.counter("reelpipe.items.executed",
                    "kind", job.getKind().name(), "status", outcome.status().name()).increment();
            return record(job, item, owner, outcome);
        } finally {
            MDC.remove("jobId");
            MDC.remove("itemId");
            MDC.remove("stageKey");
            MDC.remove("attempt");
        }
    }

    private Flow record(Job job, Item item, String owner, ExecutionOutcome outcome) {
        Instant now = clock.instant();
        switch (outcome.status()) {
            case DONE -> {
                if (itemRepo.completeClaim(item.getId(), owner, outcome.outputRef(), now) == 0) {
                    log.warn("Lease on item {} lost before completion; result discarded", item.getId());
                    return Flow.CONTINUE;
                }
                log.info("Item {} ({}) DONE → {}", item.getItemIndex(), item.getUnitKey(), outcome.outputRef());
                if (item.targetsSingleChunk()) {
                    jobService.settleChunkOwners(item.getDocumentRef(), item.getVersionRef());
                }
                if (item.isRequiresApproval() && approvalGate.onStageReached(job.getId(), item.getId())) {
                    return Flow.HALT;
                }
                return Flow.CONTINUE;
            }
            case IN_PROGRESS -> {
                itemRepo.releaseClaim(item.getId(), owner, now);
                return Flow.CONTINUE;
            }
            default -> {
                if (itemRepo.failClaim(item.getId(), owner, toItemStatus(outcome), outcome.error(), now) == 0) {
                    log.warn("Lease on item {} lost before failure was recorded", item.getId());
                    return Flow.CONTINUE;
                }
                log.warn("Item {} ({}) {}: {}", item.getItemIndex(), item.getUnitKey(), outcome.status(), outcome.error());
                if (job.getPolicy().isStopOnFirstFail()) {
                    jobService.failJob(job.getId(),
                            "item " + item.getItemIndex() + " (" + item.getUnitKey() + ") failed: " + outcome.error());
                    return Flow.HALT;
                }
                return Flow.CONTINUE;
            }
        }
    }

    /**
     * A gated item can be DONE without an approval request when its caller
     * died between the result write and the request. Such a gate would block
     * later items without pausing the job, so the request is made here.
     * Requests are idempotent per revision.
     */
    private void requestUndecidedGates(UUID jobId) {
        List<Item> undecided = itemRepo.findByJobIdAndStatusAndRequiresApprovalTrueAndGatePassedFalseOrderByItemIndexAsc(
                jobId, ItemStatus.DONE);
        for (Item item : undecided) {
            log.warn("Job {}: stage {} finished without an approval request; requesting it now",
                    jobId, item.getUnitKey());
            if (approvalGate.onStageReached(jobId, item.getId())) {
                return;
            }
        }
    }

    private static ItemStatus toItemStatus(ExecutionOutcome outcome) {
        return outcome.status() == ExecutionOutcome.Status.FAILED_VALIDATION
                ? ItemStatus.FAILED_VALIDATION
                : ItemStatus.FAILED;
    }
}
