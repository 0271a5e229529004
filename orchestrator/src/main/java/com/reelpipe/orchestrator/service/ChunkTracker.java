package com.reelpipe.orchestrator.service;

import com.reelpipe.orchestrator.claim.ClaimProtocol;
import com.reelpipe.orchestrator.model.Chunk;
import com.reelpipe.orchestrator.model.ChunkStatus;
import com.reelpipe.orchestrator.repository.ChunkRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Chunk groups: creation, per-chunk claims and results, and partial regeneration.
 *
 * Chunks follow the same lease discipline as items (see ClaimProtocol):
 * an abandoned chunk is re-claimed after its ttl while attempts remain,
 * and an explicit chunk failure stays failed until regenerated.
 */
@Service
public class ChunkTracker {

    private static final Logger log = LoggerFactory.getLogger(ChunkTracker.class);

    private final ChunkRepository chunkRepo;
    private final ClaimProtocol   claims;
    private final Clock           clock;

    public ChunkTracker(ChunkRepository chunkRepo, ClaimProtocol claims, Clock clock) {
        this.chunkRepo = chunkRepo;
        this.claims    = claims;
        this.clock     = clock;
    }

    // ------------------------------------------------------------------
    // Group lifecycle
    // ------------------------------------------------------------------

    /**
     * Create the group's chunk rows if they do not exist yet.
     *
     * Not transactional. When two callers race on a new group the loser's
     * insert violates the unique key and is dropped; the winner's rows are
     * then read back.
     */
    public ChunkGroup ensureGroup(String documentId, String versionId, List<ChunkPlanner.ChunkSpec> specs) {
        if (chunkRepo.countByDocumentIdAndVersionId(documentId, versionId) == 0) {
            List<Chunk> chunks = specs.stream()
                    .map(s -> new Chunk(documentId, versionId, s.index(), s.key()))
                    .toList();
            try {
                chunkRepo.saveAllAndFlush(chunks);
                log.info("Created chunk group {}@{} with {} chunks", documentId, versionId, chunks.size());
            } catch (DataIntegrityViolationException e) {
                log.debug("Chunk group {}@{} was created concurrently", documentId, versionId);
            }
        }
        return chunkStatus(documentId, versionId);
    }

    @Transactional(readOnly = true)
    public ChunkGroup chunkStatus(String documentId, String versionId) {
        return ChunkGroup.of(documentId, versionId,
                chunkRepo.findByDocumentIdAndVersionIdOrderByChunkIndexAsc(documentId, versionId));
    }

    // ------------------------------------------------------------------
    // Claims and results
    // ------------------------------------------------------------------

    /** Claim the lowest-index chunk that is claimable right now. */
    public Optional<Chunk> claimNext(String documentId, String versionId, String owner) {
        expireAbandoned(documentId, versionId);
        for (Chunk candidate : chunkRepo.findClaimCandidates(
                documentId, versionId, claims.maxAttempts(), clock.instant())) {
            if (claims.claimChunk(candidate, owner)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /** Claim one specific chunk, if it is claimable right now. */
    public Optional<Chunk> claimIndex(String documentId, String versionId, int index, String owner) {
        expireAbandoned(documentId, versionId);
        return chunkRepo.findByDocumentIdAndVersionIdAndChunkIndex(documentId, versionId, index)
                .filter(chunk -> claims.claimChunk(chunk, owner));
    }

    /** @return false if {@code owner} no longer held the lease; the result is then discarded */
    public boolean recordDone(Chunk chunk, String owner, String outputRef, int charCount) {
        boolean written = chunkRepo.completeClaim(chunk.getId(), owner, outputRef, charCount, clock.instant()) == 1;
        if (!written) {
            log.warn("Lease on chunk {} ({}) lost before completion; result discarded",
                    chunk.getChunkIndex(), chunk.getChunkKey());
        }
        return written;
    }

    public boolean recordFailure(Chunk chunk, String owner, ChunkStatus status, String error) {
        boolean written = chunkRepo.failClaim(chunk.getId(), owner, status, error, clock.instant()) == 1;
        if (!written) {
            log.warn("Lease on chunk {} ({}) lost before failure was recorded", chunk.getChunkIndex(), chunk.getChunkKey());
        }
        return written;
    }

    // ------------------------------------------------------------------
    // Regeneration
    // ------------------------------------------------------------------

    /**
     * Re-enqueue only the chunks that need it: FAILED, FAILED_VALIDATION and
     * NEEDS_REGEN. DONE chunks are never touched.
     *
     * @return indices put back in the queue, ascending
     */
    @Transactional
    public List<Integer> regenerateMissing(String documentId, String versionId) {
        return regenerate(documentId, versionId, true);
    }

    /**
     * @param resumeChunks true: only missing chunks; false: every chunk of the group
     * @return indices put back in the queue, ascending
     */
    @Transactional
    public List<Integer> regenerate(String documentId, String versionId, boolean resumeChunks) {
        List<Chunk> chunks = chunkRepo.findByDocumentIdAndVersionIdOrderByChunkIndexAsc(documentId, versionId);
        if (chunks.isEmpty()) {
            throw new ChunkGroupNotFoundException(documentId, versionId);
        }
        List<Integer> enqueued = new ArrayList<>();
        for (Chunk chunk : chunks) {
            if (!resumeChunks || ChunkStatus.MISSING.contains(chunk.getStatus())) {
                chunk.requeue();
                enqueued.add(chunk.getChunkIndex());
            }
        }
        log.info("Re-enqueued chunks {} of {}@{} (resumeChunks={})", enqueued, documentId, versionId, resumeChunks);
        return enqueued;
    }

    private void expireAbandoned(String documentId, String versionId) {
        int expired = chunkRepo.expireAbandoned(documentId, versionId, claims.maxAttempts(), clock.instant());
        if (expired > 0) {
            log.warn("Failed {} abandoned chunk(s) of {}@{} after {} attempts",
                    expired, documentId, versionId, claims.maxAttempts());
        }
    }
}
