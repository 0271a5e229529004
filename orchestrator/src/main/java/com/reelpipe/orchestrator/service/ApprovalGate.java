package com.reelpipe.orchestrator.service;

import com.reelpipe.orchestrator.ladder.StageLadderRegistry;
import com.reelpipe.orchestrator.model.*;
import com.reelpipe.orchestrator.repository.ApprovalCheckpointRepository;
import com.reelpipe.orchestrator.repository.ItemRepository;
import com.reelpipe.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Human checkpoints inside an automated ladder.
 *
 * A gated item runs like any other; once its output exists the gate is
 * requested and the job pauses with awaiting_approval set. Items after the
 * gate stay unclaimable (ItemRepository#findGateBarrier) until a decision:
 * <ul>
 *   <li>approve: the output is pinned as the input for later stages and the job runs on</li>
 *   <li>reject: the item goes to NEEDS_REGEN under a new revision; the job runs on
 *       or stays paused depending on the reject policy</li>
 * </ul>
 * A rejected revision is never requested again; only a fresh proposal
 * (the next revision's output) can reopen the gate.
 */
@Service
public class ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    private final JobRepository                jobRepo;
    private final ItemRepository               itemRepo;
    private final ApprovalCheckpointRepository checkpointRepo;
    private final JobReconciler                reconciler;
    private final StageLadderRegistry          ladders;
    private final Clock                        clock;

    public ApprovalGate(JobRepository jobRepo,
                        ItemRepository itemRepo,
                        ApprovalCheckpointRepository checkpointRepo,
                        JobReconciler reconciler,
                        StageLadderRegistry ladders,
                        Clock clock) {
        this.jobRepo        = jobRepo;
        this.itemRepo       = itemRepo;
        this.checkpointRepo = checkpointRepo;
        this.reconciler     = reconciler;
        this.ladders        = ladders;
        this.clock          = clock;
    }

    // ------------------------------------------------------------------
    // Request
    // ------------------------------------------------------------------

    /**
     * Called right after a gated item finished.
     *
     * Steps:
     *  1. Skip items that are not gated, already passed, or not DONE
     *  2. Reuse an open request for the same revision (concurrent ticks)
     *  3. Send a revision that was already rejected back for regeneration
     *  4. Record a new checkpoint; auto-approve it if the policy says so,
     *     otherwise pause the job at the gate
     *
     * @return true if the job is now waiting for a decision
     */
    @Transactional
    public boolean onStageReached(UUID jobId, UUID itemId) {
        Job job = jobRepo.findByIdForUpdate(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        Item item = itemRepo.findById(itemId)
                .orElseThrow(() -> new IllegalStateException("Item " + itemId + " vanished"));
        if (!item.isRequiresApproval() || item.isGatePassed() || item.getStatus() != ItemStatus.DONE) {
            return false;
        }

        Instant now = clock.instant();
        Optional<ApprovalCheckpoint> latest = checkpointRepo.findFirstByItemIdOrderByRevisionDesc(itemId)
                .filter(c -> c.getRevision() == item.getRevision());
        if (latest.isPresent()) {
            switch (latest.get().getState()) {
                case REQUESTED -> {
                    return job.isAwaitingApproval();
                }
                case APPROVED -> {
                    item.pinOutput();
                    return false;
                }
                case REJECTED -> {
                    // Never re-request a rejected revision; send the item back for a fresh proposal.
                    log.warn("Job {} stage {} revision {} was already rejected; marking it for regeneration",
                            jobId, item.getUnitKey(), item.getRevision());
                    item.markNeedsRegen("revision " + item.getRevision() + " was rejected");
                    return false;
                }
            }
        }

        ApprovalCheckpoint checkpoint = checkpointRepo.save(new ApprovalCheckpoint(jobId, item, now));

        if (job.getPolicy().isAutoApprove()) {
            checkpoint.decide(true, "auto-approved", now);
            item.pinOutput();
            log.info("Job {} stage {} auto-approved (revision {})", jobId, item.getUnitKey(), item.getRevision());
            return false;
        }

        if (job.getStatus() == JobStatus.RUNNING || job.getStatus() == JobStatus.PAUSED) {
            job.awaitApproval(item.getUnitKey(), item.getOutputRef());
        }
        reconciler.reconcile(job, itemRepo.findByJobIdOrderByItemIndexAsc(jobId));
        log.info("Job {} awaiting approval for stage {} (artifact {})", jobId, item.getUnitKey(), item.getOutputRef());
        return true;
    }

    // ------------------------------------------------------------------
    // Decide
    // ------------------------------------------------------------------

    /**
     * Record a human decision on the stage the job is waiting at.
     *
     * @throws IllegalJobStateException if the job is not waiting at {@code stageKey}
     *         (already decided, stale client, wrong stage)
     */
    @Transactional
    public Job decide(UUID jobId, String stageKey, boolean approved, String note) {
        Job job = jobRepo.findByIdForUpdate(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        String stage = ladders.normalizeStage(stageKey);
        if (!job.isAwaitingApproval() || !stageMatches(job.getApprovalRequiredFor(), stageKey, stage)) {
            throw new IllegalJobStateException("Job " + jobId + " is not awaiting approval for stage " + stageKey);
        }
        String pending = job.getApprovalRequiredFor();

        ApprovalCheckpoint checkpoint = checkpointRepo
                .findFirstByJobIdAndStageKeyAndStateOrderByRevisionDesc(jobId, pending, ApprovalState.REQUESTED)
                .orElseThrow(() -> new IllegalJobStateException("No open approval request for stage " + pending));
        Item item = itemRepo.findById(checkpoint.getItemId())
                .orElseThrow(() -> new IllegalStateException("Item " + checkpoint.getItemId() + " vanished"));

        checkpoint.decide(approved, note, clock.instant());
        job.clearApproval();

        if (approved) {
            item.pinOutput();
            job.setStatus(JobStatus.RUNNING);
            job.setPauseReason(null);
            log.info("Job {} stage {} APPROVED (revision {}, pinned {})",
                    jobId, pending, item.getRevision(), item.getPinnedRef());
        } else {
            item.markNeedsRegen(note == null || note.isBlank() ? "rejected" : "rejected: " + note);
            if (job.getPolicy().getRejectAction() == RejectAction.REGENERATE) {
                job.setStatus(JobStatus.RUNNING);
                job.setPauseReason(null);
            } else {
                job.setPauseReason("approval rejected for " + pending);
            }
            log.info("Job {} stage {} REJECTED; item now revision {} ({})",
                    jobId, pending, item.getRevision(), job.getStatus());
        }

        reconciler.reconcile(job, itemRepo.findByJobIdOrderByItemIndexAsc(jobId));
        return job;
    }

    @Transactional(readOnly = true)
    public List<ApprovalCheckpoint> history(UUID jobId) {
        return checkpointRepo.findByJobIdOrderByRequestedAtAsc(jobId);
    }

    // Gates are keyed by unit ("treatment", "clip-hook"); only ladder stages have aliases.
    private static boolean stageMatches(String pending, String raw, String normalized) {
        return pending != null && (pending.equals(raw) || pending.equals(normalized));
    }
}
