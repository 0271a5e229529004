package com.reelpipe.orchestrator.service;

import com.reelpipe.orchestrator.ladder.StageLadderRegistry;
import com.reelpipe.orchestrator.model.*;
import com.reelpipe.orchestrator.repository.ItemRepository;
import com.reelpipe.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Job lifecycle: start, status, pause/resume/stop, retry, targeted
 * regeneration, and the counter refresh that closes every tick.
 *
 * Every method that changes a job first takes the job row lock
 * (findByIdForUpdate), so concurrent ticks and API calls apply their
 * status changes one after another.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private static final Set<ItemStatus> REGENERABLE =
            EnumSet.of(ItemStatus.DONE, ItemStatus.SKIPPED, ItemStatus.FAILED, ItemStatus.FAILED_VALIDATION);

    private final JobRepository     jobRepo;
    private final ItemRepository    itemRepo;
    private final JobPlanner        planner;
    private final JobReconciler     reconciler;
    private final ChunkTracker      chunkTracker;
    private final ProgressEstimator estimator;
    private final StageLadderRegistry ladders;
    private final Clock             clock;

    public JobService(JobRepository jobRepo,
                      ItemRepository itemRepo,
                      JobPlanner planner,
                      JobReconciler reconciler,
                      ChunkTracker chunkTracker,
                      ProgressEstimator estimator,
                      StageLadderRegistry ladders,
                      Clock clock) {
        this.jobRepo      = jobRepo;
        this.itemRepo     = itemRepo;
        this.planner      = planner;
        this.reconciler   = reconciler;
        this.chunkTracker = chunkTracker;
        this.estimator    = estimator;
        this.ladders      = ladders;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Start
    // ------------------------------------------------------------------

    /**
     * Create a job and materialize its items.
     *
     * Steps:
     *  1. Normalize the format ("Vertical_Drama" → "vertical-drama")
     *  2. If the project already has an active job of this kind, return it unchanged
     *  3. Plan the items (ladder slice, episodes, or trailer units)
     *  4. Save the job (QUEUED) and its items (QUEUED, index order)
     *
     * The job turns RUNNING on its first tick.
     */
    @Transactional
    public Job start(JobRequest request) {
        String format = ladders.normalizeFormat(request.format());

        Optional<Job> active = jobRepo.findActive(request.kind(), request.projectRef());
        if (active.isPresent()) {
            log.info("Job {} is already {} for {} {}; returning it",
                    active.get().getId(), active.get().getStatus(), request.kind(), request.projectRef());
            return active.get();
        }

        List<JobPlanner.PlannedItem> planned = planner.plan(request.kind(), format, request.options());

        Job job = jobRepo.save(new Job(request.kind(), request.projectRef(), format, request.policy(), clock.instant()));
        List<Item> items = new ArrayList<>();
        for (int i = 0; i < planned.size(); i++) {
            JobPlanner.PlannedItem p = planned.get(i);
            Item item = new Item(job.getId(), i, p.stageKey(), p.unitKey());
            item.setRequiresApproval(p.requiresApproval());
            item.setEstimatedChars(p.estimatedChars());
            item.setEpisodeSpan(p.episodeSpan());
            item.setDocumentRef(request.projectRef() + ":" + p.unitKey());
            items.add(item);
        }
        itemRepo.saveAll(items);
        reconciler.reconcile(job, items);

        log.info("Job {} created: {} {} ({}) with {} items",
                job.getId(), request.kind(), request.projectRef(), format, items.size());
        return job;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<Job> findById(UUID id) {
        return jobRepo.findById(id);
    }

    public Job getJob(UUID id) {
        return jobRepo.findById(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public List<Item> getItems(UUID jobId) {
        return itemRepo.findByJobIdOrderByItemIndexAsc(jobId);
    }

    /** Newest job for a project, optionally of one kind. Used to resume after a reload. */
    public Optional<Job> findLatest(String projectRef, JobKind kind) {
        return kind == null
                ? jobRepo.findFirstByProjectRefOrderByCreatedAtDesc(projectRef)
                : jobRepo.findFirstByProjectRefAndKindOrderByCreatedAtDesc(projectRef, kind);
    }

    /** Fresh status read, bypassing any cached entity. */
    public JobStatus currentStatus(UUID jobId) {
        return jobRepo.findStatusById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Transactional(readOnly = true)
    public Progress progress(UUID jobId) {
        Job job = getJob(jobId);
        return estimator.estimate(job, itemRepo.findByJobIdOrderByItemIndexAsc(jobId), clock.instant());
    }

    // ------------------------------------------------------------------
    // Pause / resume / stop
    // ------------------------------------------------------------------

    /**
     * QUEUED/RUNNING → PAUSED. Idempotent on a paused job.
     * Items already dispatched in a running tick finish; nothing new is claimed.
     */
    @Transactional
    public Job pause(UUID jobId) {
        Job job = lock(jobId);
        switch (job.getStatus()) {
            case QUEUED, RUNNING -> {
                job.setStatus(JobStatus.PAUSED);
                job.setPauseReason("paused by user");
                log.info("Job {} PAUSED by user", jobId);
            }
            case PAUSED -> log.debug("Job {} already paused", jobId);
            default -> throw new IllegalJobStateException("Cannot pause job " + jobId + " in state " + job.getStatus());
        }
        return job;
    }

    /**
     * PAUSED → RUNNING. Idempotent on a running job.
     * A job paused at an approval gate can only continue through a decision.
     */
    @Transactional
    public Job resume(UUID jobId) {
        Job job = lock(jobId);
        switch (job.getStatus()) {
            case PAUSED -> {
                if (job.isAwaitingApproval()) {
                    throw new IllegalJobStateException("Job " + jobId + " is awaiting approval for "
                            + job.getApprovalRequiredFor() + "; record a decision instead");
                }
                job.setStatus(JobStatus.RUNNING);
                job.setPauseReason(null);
                log.info("Job {} RESUMED at index {}", jobId, job.getCurrentStageIndex());
            }
            case QUEUED, RUNNING -> log.debug("Job {} already {}", jobId, job.getStatus());
            default -> throw new IllegalJobStateException("Cannot resume job " + jobId + " in state " + job.getStatus());
        }
        return job;
    }

    /** Any non-terminal state → STOPPED. Items stay as they are for inspection. */
    @Transactional
    public Job stop(UUID jobId) {
        Job job = lock(jobId);
        switch (job.getStatus()) {
            case QUEUED, RUNNING, PAUSED -> {
                job.setStatus(JobStatus.STOPPED);
                job.clearApproval();
                job.setPauseReason(null);
                job.setFinishedAt(clock.instant());
                log.info("Job {} STOPPED", jobId);
            }
            case STOPPED -> log.debug("Job {} already stopped", jobId);
            default -> throw new IllegalJobStateException("Cannot stop job " + jobId + " in state " + job.getStatus());
        }
        return job;
    }

    // ------------------------------------------------------------------
    // Failure and recovery
    // ------------------------------------------------------------------

    /** RUNNING → FAILED, used when a policy escalates an item failure to the job. */
    @Transactional
    public Job failJob(UUID jobId, String reason) {
        Job job = lock(jobId);
        if (job.getStatus() == JobStatus.RUNNING) {
            job.setStatus(JobStatus.FAILED);
            job.setLastError(reason);
            job.setFinishedAt(clock.instant());
            log.error("Job {} FAILED: {}", jobId, reason);
        }
        reconciler.reconcile(job, itemRepo.findByJobIdOrderByItemIndexAsc(jobId));
        return job;
    }

    /**
     * Requeue FAILED items and flip the job back to RUNNING.
     *
     * Completed items are untouched and revisions are kept, so chunked
     * items pick up their existing chunk groups; only failed chunks run again.
     * FAILED_VALIDATION items are left for targeted regeneration.
     */
    @Transactional
    public Job retry(UUID jobId) {
        Job job = lock(jobId);
        boolean allowed = job.getStatus() == JobStatus.FAILED
                || job.getStatus() == JobStatus.RUNNING
                || (job.getStatus() == JobStatus.PAUSED && !job.isAwaitingApproval());
        if (!allowed) {
            throw new IllegalJobStateException("Cannot retry job " + jobId + " in state " + job.getStatus()
                    + (job.isAwaitingApproval() ? " (awaiting approval)" : ""));
        }

        List<Item> failed = itemRepo.findByJobIdAndStatusInOrderByItemIndexAsc(jobId, EnumSet.of(ItemStatus.FAILED));
        for (Item item : failed) {
            item.requeue();
            requeueChunks(item);
        }

        job.setStatus(JobStatus.RUNNING);
        job.setLastError(null);
        job.setPauseReason(null);
        job.setFinishedAt(null);
        reconciler.reconcile(job, itemRepo.findByJobIdOrderByItemIndexAsc(jobId));
        log.info("Job {} RETRY: requeued {} failed item(s)", jobId, failed.size());
        return job;
    }

    /**
     * Mark items for regeneration under a new revision.
     *
     * With no ids, every FAILED_VALIDATION item is selected. Selected items
     * must be settled or failed; running and queued items are left alone.
     * A paused (not awaiting approval) or failed job goes back to RUNNING.
     */
    @Transactional
    public Job regenItems(UUID jobId, List<UUID> itemIds) {
        Job job = lock(jobId);
        if (job.getStatus() == JobStatus.COMPLETED || job.getStatus() == JobStatus.STOPPED) {
            throw new IllegalJobStateException("Job " + jobId + " is " + job.getStatus()
                    + "; start a new run to regenerate its items");
        }

        List<Item> items = itemRepo.findByJobIdOrderByItemIndexAsc(jobId);
        List<Item> selected;
        if (itemIds == null || itemIds.isEmpty()) {
            selected = items.stream().filter(i -> i.getStatus() == ItemStatus.FAILED_VALIDATION).toList();
        } else {
            Map<UUID, Item> byId = items.stream().collect(Collectors.toMap(Item::getId, Function.identity()));
            Set<UUID> unknown = new HashSet<>(itemIds);
            unknown.removeAll(byId.keySet());
            if (!unknown.isEmpty()) {
                throw new IllegalArgumentException("Items " + unknown + " do not belong to job " + jobId);
            }
            selected = itemIds.stream().distinct().map(byId::get).toList();
        }

        for (Item item : selected) {
            if (!REGENERABLE.contains(item.getStatus())) {
                throw new IllegalJobStateException("Item " + item.getId() + " is " + item.getStatus()
                        + " and cannot be regenerated");
            }
            item.markNeedsRegen("regeneration requested");
        }

        if (!selected.isEmpty() && (job.getStatus() == JobStatus.FAILED
                || (job.getStatus() == JobStatus.PAUSED && !job.isAwaitingApproval()))) {
            job.setStatus(JobStatus.RUNNING);
            job.setPauseReason(null);
            job.setFinishedAt(null);
        }
        reconciler.reconcile(job, items);
        log.info("Job {} REGEN: {} item(s) marked needs_regen", jobId, selected.size());
        return job;
    }

    /**
     * Re-enqueue missing chunks of a document version and start a CHUNK_REGEN
     * job with one item per chunk that is not DONE. Chunks still queued behind
     * a failed one are included, so the job always finishes the group. No job
     * is created when every chunk is already DONE; the group's owners are then
     * settled directly.
     *
     * @throws IllegalJobStateException if a regeneration for this version is still active
     */
    @Transactional
    public ChunkRegenOutcome startChunkRegen(String documentId, String versionId, boolean resumeChunks) {
        String projectRef = documentId + "@" + versionId;
        jobRepo.findActive(JobKind.CHUNK_REGEN, projectRef).ifPresent(active -> {
            throw new IllegalJobStateException("Chunk regeneration for " + projectRef
                    + " is already " + active.getStatus() + " as job " + active.getId());
        });

        List<Integer> enqueued = chunkTracker.regenerate(documentId, versionId, resumeChunks);
        ChunkGroup group = chunkTracker.chunkStatus(documentId, versionId);
        List<ChunkGroup.ChunkView> pending = group.chunks().stream()
                .filter(c -> c.status() != ChunkStatus.DONE)
                .toList();
        if (pending.isEmpty()) {
            settleChunkOwners(documentId, versionId);
            return new ChunkRegenOutcome(documentId, versionId, enqueued, null);
        }

        Job job = jobRepo.save(new Job(JobKind.CHUNK_REGEN, projectRef, ladders.defaultFormat(),
                JobPolicy.defaults(), clock.instant()));
        List<Item> items = new ArrayList<>();
        for (int i = 0; i < pending.size(); i++) {
            ChunkGroup.ChunkView chunk = pending.get(i);
            Item item = new Item(job.getId(), i, "chunk", chunk.key());
            item.targetChunk(documentId, versionId, chunk.index());
            items.add(item);
        }
        itemRepo.saveAll(items);
        reconciler.reconcile(job, items);
        log.info("Job {} created to regenerate chunks {} of {} (re-enqueued {})", job.getId(),
                pending.stream().map(ChunkGroup.ChunkView::index).toList(), projectRef, enqueued);
        return new ChunkRegenOutcome(documentId, versionId, enqueued, job);
    }

    /**
     * Once a chunk group is complete, hand its assembled output to the item
     * that owns it. Owners that failed on this version become DONE and their
     * job's counters are recomputed. A gated owner of a completed job reopens
     * the job so the next tick asks for its approval.
     *
     * @return the owners that were settled; empty while the group is incomplete
     */
    @Transactional
    public List<Item> settleChunkOwners(String documentId, String versionId) {
        ChunkGroup group = chunkTracker.chunkStatus(documentId, versionId);
        if (!group.isComplete()) {
            return List.of();
        }
        List<Item> owners = itemRepo.findByDocumentRefAndChunkIndexIsNull(documentId).stream()
                .filter(i -> i.getStatus().isError() && versionId.equals(i.getVersionRef()))
                .toList();
        Instant now = clock.instant();
        for (Item owner : owners) {
            owner.settleDone(group.assembledRef(), now);
            Job job = lock(owner.getJobId());
            if (owner.isRequiresApproval() && job.getStatus() == JobStatus.COMPLETED) {
                job.setStatus(JobStatus.RUNNING);
                job.setFinishedAt(null);
            }
            reconciler.reconcile(job, itemRepo.findByJobIdOrderByItemIndexAsc(job.getId()));
            log.info("Job {} item {} ({}) DONE from regenerated chunks → {}",
                    job.getId(), owner.getItemIndex(), owner.getUnitKey(), group.assembledRef());
        }
        return owners;
    }

    public record ChunkRegenOutcome(String documentId, String versionId, List<Integer> enqueuedIndices, Job job) {}

    // ------------------------------------------------------------------
    // Tick support
    // ------------------------------------------------------------------

    /** Recompute counters and completion from item rows under the job lock. */
    @Transactional
    public Job refreshProgress(UUID jobId) {
        Job job = lock(jobId);
        reconciler.reconcile(job, itemRepo.findByJobIdOrderByItemIndexAsc(jobId));
        return job;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Job lock(UUID jobId) {
        return jobRepo.findByIdForUpdate(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    // A failed chunked item owns a chunk group; its failed chunks must run again too.
    private void requeueChunks(Item item) {
        if (item.getDocumentRef() == null) {
            return;
        }
        if (item.targetsSingleChunk()
                || !chunkTracker.chunkStatus(item.getDocumentRef(), item.getVersionRef()).isEmpty()) {
            chunkTracker.regenerateMissing(item.getDocumentRef(), item.getVersionRef());
        }
    }
}
