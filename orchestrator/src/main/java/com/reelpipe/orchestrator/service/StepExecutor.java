package com.reelpipe.orchestrator.service;

import com.reelpipe.orchestrator.claim.IdempotencyKeys;
import com.reelpipe.orchestrator.generation.GenerationClient;
import com.reelpipe.orchestrator.generation.GenerationException;
import com.reelpipe.orchestrator.generation.OutputValidator;
import com.reelpipe.orchestrator.generation.dto.GenerationRequest;
import com.reelpipe.orchestrator.generation.dto.GenerationResult;
import com.reelpipe.orchestrator.model.*;
import com.reelpipe.orchestrator.repository.ItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs one claimed item: at most one generation call per invocation.
 *
 * Re-invocation is safe: a DONE item returns its existing output without a
 * call, chunk work already DONE is never repeated, and every call carries
 * a content-derived idempotency key.
 *
 * Provider errors never escape: they become a FAILED outcome. Outputs that
 * fail a validator become FAILED_VALIDATION. There is no internal retry.
 */
@Component
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final GenerationClient      client;
    private final List<OutputValidator> validators;
    private final ChunkPlanner          chunkPlanner;
    private final ChunkTracker          chunkTracker;
    private final ItemRepository        itemRepo;

    public StepExecutor(GenerationClient client,
                        List<OutputValidator> validators,
                        ChunkPlanner chunkPlanner,
                        ChunkTracker chunkTracker,
                        ItemRepository itemRepo) {
        this.client       = client;
        this.validators   = validators;
        this.chunkPlanner = chunkPlanner;
        this.chunkTracker = chunkTracker;
        this.itemRepo     = itemRepo;
    }

    /**
     * @param owner lease owner of the item; chunk claims are taken under the same owner
     */
    public ExecutionOutcome execute(Job job, Item item, String owner) {
        if (item.getStatus() == ItemStatus.DONE) {
            log.debug("Item {} already done; nothing to execute", item.getId());
            return ExecutionOutcome.done(item.getOutputRef());
        }
        if (item.targetsSingleChunk()) {
            return executeTargetedChunk(job, item, owner);
        }
        List<ChunkPlanner.ChunkSpec> plan = chunkPlanner.plan(item);
        if (!plan.isEmpty()) {
            return executeNextChunk(job, item, plan, owner);
        }

        int episode = job.getKind() == JobKind.EPISODE_SCRIPTS ? item.getItemIndex() + 1 : 0;
        GenerationRequest request = request(job, item, IdempotencyKeys.forItem(item), null, episode, episode);
        return invoke(request).outcome();
    }

    // ------------------------------------------------------------------
    // Chunked items
    // ------------------------------------------------------------------

    /**
     * One chunk per invocation. Returns IN_PROGRESS while chunks remain,
     * DONE once the whole group is done, and the chunk's failure otherwise.
     */
    private ExecutionOutcome executeNextChunk(Job job, Item item, List<ChunkPlanner.ChunkSpec> plan, String owner) {
        String documentId = item.getDocumentRef();
        String versionId  = item.getVersionRef();
        chunkTracker.ensureGroup(documentId, versionId, plan);

        Optional<Chunk> claimed = chunkTracker.claimNext(documentId, versionId, owner);
        if (claimed.isEmpty()) {
            return settle(chunkTracker.chunkStatus(documentId, versionId));
        }

        Chunk chunk = claimed.get();
        int[] episodes = ChunkPlanner.episodeRange(chunk.getChunkKey());
        ExecutionOutcome chunkOutcome = runChunk(job, item, chunk, episodes, owner);
        if (chunkOutcome.isFailure()) {
            return chunkOutcome;
        }

        ChunkGroup group = chunkTracker.chunkStatus(documentId, versionId);
        log.info("Item {} chunk {} done ({}/{})", item.getId(), chunk.getChunkKey(),
                group.doneCount(), group.chunks().size());
        return group.isComplete() ? ExecutionOutcome.done(group.assembledRef()) : ExecutionOutcome.inProgress();
    }

    /** A chunk-regeneration item works exactly one chunk of an existing group. */
    private ExecutionOutcome executeTargetedChunk(Job job, Item item, String owner) {
        String documentId = item.getDocumentRef();
        String versionId  = item.getVersionRef();
        int index         = item.getChunkIndex();

        ChunkGroup group = chunkTracker.chunkStatus(documentId, versionId);
        Optional<ChunkGroup.ChunkView> current = group.chunk(index);
        if (current.isEmpty()) {
            return ExecutionOutcome.failed("chunk " + index + " of " + documentId + "@" + versionId + " does not exist");
        }
        if (current.get().status() == ChunkStatus.DONE) {
            return ExecutionOutcome.done(current.get().outputRef());
        }

        Optional<Chunk> claimed = chunkTracker.claimIndex(documentId, versionId, index, owner);
        if (claimed.isEmpty()) {
            ChunkGroup.ChunkView now = chunkTracker.chunkStatus(documentId, versionId).chunk(index).orElseThrow();
            if (now.status().isError()) {
                return failure(now.status(), "chunk " + now.key() + ": " + now.error());
            }
            // Held by a live lease elsewhere; try again on a later tick.
            return ExecutionOutcome.inProgress();
        }
        Chunk chunk = claimed.get();
        ExecutionOutcome outcome = runChunk(job, item, chunk, ChunkPlanner.episodeRange(chunk.getChunkKey()), owner);
        return outcome.isFailure() ? outcome : ExecutionOutcome.done(outcome.outputRef());
    }

    private ExecutionOutcome runChunk(Job job, Item item, Chunk chunk, int[] episodes, String owner) {
        GenerationRequest request = request(job, item, IdempotencyKeys.forChunk(chunk),
                chunk.getChunkKey(), episodes[0], episodes[1]);
        Call call = invoke(request);
        ExecutionOutcome outcome = call.outcome();
        if (outcome.isFailure()) {
            ChunkStatus status = outcome.status() == ExecutionOutcome.Status.FAILED_VALIDATION
                    ? ChunkStatus.FAILED_VALIDATION : ChunkStatus.FAILED;
            chunkTracker.recordFailure(chunk, owner, status, outcome.error());
            return failure(status, "chunk " + chunk.getChunkKey() + ": " + outcome.error());
        }
        if (!chunkTracker.recordDone(chunk, owner, outcome.outputRef(), call.charCount())) {
            return ExecutionOutcome.inProgress();
        }
        return outcome;
    }

    // If no chunk could be claimed: finished, failed, or held by someone else.
    private static ExecutionOutcome settle(ChunkGroup group) {
        if (group.isComplete()) {
            return ExecutionOutcome.done(group.assembledRef());
        }
        return group.firstError()
                .map(c -> failure(c.status(), "chunk " + c.key() + ": " + c.error()))
                .orElseGet(ExecutionOutcome::inProgress);
    }

    private static ExecutionOutcome failure(ChunkStatus status, String error) {
        return status == ChunkStatus.FAILED_VALIDATION
                ? ExecutionOutcome.failedValidation(error)
                : ExecutionOutcome.failed(error);
    }

    // ------------------------------------------------------------------
    // Generation call
    // ------------------------------------------------------------------

    private record Call(ExecutionOutcome outcome, int charCount) {}

    private Call invoke(GenerationRequest request) {
        GenerationResult result;
        try {
            result = client.generate(request);
        } catch (GenerationException e) {
            log.warn("Generation failed for {} {}: {}", request.stageKey(), request.unitKey(), e.getMessage());
            return new Call(ExecutionOutcome.failed(e.getMessage()), 0);
        } catch (RuntimeException e) {
            log.error("Unexpected error calling generation for {} {}", request.stageKey(), request.unitKey(), e);
            return new Call(ExecutionOutcome.failed("unexpected error: " + e.getMessage()), 0);
        }

        List<String> issues = new ArrayList<>(result.issues());
        for (OutputValidator validator : validators) {
            issues.addAll(validator.validate(request, result));
        }
        if (!issues.isEmpty()) {
            log.warn("Output of {} {} failed validation: {}", request.stageKey(), request.unitKey(), issues);
            return new Call(ExecutionOutcome.failedValidation(String.join("; ", issues)), result.charCount());
        }
        if (result.outputRef() == null || result.outputRef().isBlank()) {
            return new Call(ExecutionOutcome.failed("generation returned no output reference"), result.charCount());
        }
        return new Call(ExecutionOutcome.done(result.outputRef()), result.charCount());
    }

    private GenerationRequest request(Job job, Item item, String idempotencyKey,
                                      String chunkKey, int episodeFrom, int episodeTo) {
        return new GenerationRequest(
                idempotencyKey,
                job.getKind().name(),
                job.getProjectRef(),
                job.getFormat(),
                item.getStageKey(),
                item.getUnitKey(),
                item.getRevision(),
                inputRef(job, item),
                chunkKey,
                episodeFrom,
                episodeTo);
    }

    // Ladder stages build on the previous stage; an approved stage is read from its pinned ref.
    private String inputRef(Job job, Item item) {
        if (job.getKind() != JobKind.DOCUMENT_AUTORUN || item.getItemIndex() == 0) {
            return null;
        }
        return itemRepo.findFirstByJobIdAndItemIndexLessThanAndStatusOrderByItemIndexDesc(
                        item.getJobId(), item.getItemIndex(), ItemStatus.DONE)
                .map(prev -> prev.getPinnedRef() != null ? prev.getPinnedRef() : prev.getOutputRef())
                .orElse(null);
    }
}
