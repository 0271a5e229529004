package com.reelpipe.orchestrator.repository;

import com.reelpipe.orchestrator.model.Item;
import com.reelpipe.orchestrator.model.ItemStatus;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD, claim and fenced-write queries for the job_items table.
 *
 * The conditional UPDATEs below are the only synchronization the tick
 * controller relies on. Each returns the number of rows it changed: 1 means
 * the caller won, 0 means someone else got there first (or the lease was lost).
 */
public interface ItemRepository extends JpaRepository<Item, UUID> {

    List<Item> findByJobIdOrderByItemIndexAsc(UUID jobId);

    List<Item> findByJobIdAndStatusInOrderByItemIndexAsc(UUID jobId, Collection<ItemStatus> statuses);

    /** Finished gated items that have not been approved; each needs an open approval request. */
    List<Item> findByJobIdAndStatusAndRequiresApprovalTrueAndGatePassedFalseOrderByItemIndexAsc(
            UUID jobId, ItemStatus status);

    /** Items that own a chunk group of {@code documentRef} (chunk-regeneration items excluded). */
    List<Item> findByDocumentRefAndChunkIndexIsNull(String documentRef);

    /** The nearest finished item before {@code itemIndex}; its artifact feeds the next stage. */
    Optional<Item> findFirstByJobIdAndItemIndexLessThanAndStatusOrderByItemIndexDesc(
            UUID jobId, int itemIndex, ItemStatus status);

    /**
     * Lowest index of a gated item whose gate has not been passed yet.
     * Items above it must not run until a decision is recorded.
     */
    @Query("""
            SELECT MIN(i.itemIndex) FROM Item i
            WHERE i.jobId = :jobId AND i.requiresApproval = true AND i.gatePassed = false
            """)
    Optional<Integer> findGateBarrier(@Param("jobId") UUID jobId);

    /**
     * Items a caller may try to claim, lowest index first: queued or
     * needs_regen, or running under an expired lease, with attempts left,
     * and not past the approval barrier.
     */
    @Query("""
            SELECT i FROM Item i
            WHERE i.jobId = :jobId
              AND i.itemIndex <= :barrier
              AND i.attempts < :maxAttempts
              AND (i.status IN :claimable OR (i.status = :running AND i.claimExpiresAt < :now))
            ORDER BY i.itemIndex ASC
            """)
    List<Item> findClaimCandidates(@Param("jobId") UUID jobId,
                                   @Param("barrier") int barrier,
                                   @Param("maxAttempts") int maxAttempts,
                                   @Param("claimable") Collection<ItemStatus> claimable,
                                   @Param("running") ItemStatus running,
                                   @Param("now") Instant now,
                                   Pageable page);

    default List<Item> findClaimCandidates(UUID jobId, int barrier, int maxAttempts, Instant now, int limit) {
        return findClaimCandidates(jobId, barrier, maxAttempts,
                ItemStatus.CLAIMABLE, ItemStatus.RUNNING, now, PageRequest.of(0, limit));
    }

    // ------------------------------------------------------------------
    // Claim (lease) and fenced result writes
    // ------------------------------------------------------------------

    /**
     * Take the lease on one item. Succeeds only if the item is claimable
     * right now, so two callers can never both own it.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Item i
               SET i.status = :running, i.claimOwner = :owner, i.claimKey = :claimKey,
                   i.claimedAt = :now, i.claimExpiresAt = :expiresAt,
                   i.attempts = i.attempts + 1, i.startedAt = :now, i.updatedAt = :now
             WHERE i.id = :id
               AND i.attempts < :maxAttempts
               AND (i.status IN :claimable OR (i.status = :running AND i.claimExpiresAt < :now))
            """)
    int tryClaim(@Param("id") UUID id,
                 @Param("owner") String owner,
                 @Param("claimKey") String claimKey,
                 @Param("now") Instant now,
                 @Param("expiresAt") Instant expiresAt,
                 @Param("maxAttempts") int maxAttempts,
                 @Param("claimable") Collection<ItemStatus> claimable,
                 @Param("running") ItemStatus running);

    default int tryClaim(UUID id, String owner, String claimKey, Instant now, Instant expiresAt, int maxAttempts) {
        return tryClaim(id, owner, claimKey, now, expiresAt, maxAttempts, ItemStatus.CLAIMABLE, ItemStatus.RUNNING);
    }

    /** RUNNING → DONE, only while {@code owner} still holds the lease. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Item i
               SET i.status = :done, i.outputRef = :outputRef, i.error = null,
                   i.attempts = 0, i.finishedAt = :now, i.updatedAt = :now,
                   i.claimOwner = null, i.claimExpiresAt = null
             WHERE i.id = :id AND i.status = :running AND i.claimOwner = :owner
            """)
    int completeClaim(@Param("id") UUID id,
                      @Param("owner") String owner,
                      @Param("outputRef") String outputRef,
                      @Param("now") Instant now,
                      @Param("done") ItemStatus done,
                      @Param("running") ItemStatus running);

    default int completeClaim(UUID id, String owner, String outputRef, Instant now) {
        return completeClaim(id, owner, outputRef, now, ItemStatus.DONE, ItemStatus.RUNNING);
    }

    /** RUNNING → FAILED / FAILED_VALIDATION, only while {@code owner} still holds the lease. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Item i
               SET i.status = :status, i.error = :error, i.finishedAt = :now, i.updatedAt = :now,
                   i.claimOwner = null, i.claimExpiresAt = null
             WHERE i.id = :id AND i.status = :running AND i.claimOwner = :owner
            """)
    int failClaim(@Param("id") UUID id,
                  @Param("owner") String owner,
                  @Param("status") ItemStatus status,
                  @Param("error") String error,
                  @Param("now") Instant now,
                  @Param("running") ItemStatus running);

    default int failClaim(UUID id, String owner, ItemStatus status, String error, Instant now) {
        return failClaim(id, owner, status, error, now, ItemStatus.RUNNING);
    }

    /**
     * RUNNING → QUEUED after partial progress (one chunk of a chunked item).
     * Attempts reset: the item made progress, so it starts a new attempt budget.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Item i
               SET i.status = :queued, i.attempts = 0, i.updatedAt = :now,
                   i.claimOwner = null, i.claimExpiresAt = null
             WHERE i.id = :id AND i.status = :running AND i.claimOwner = :owner
            """)
    int releaseClaim(@Param("id") UUID id,
                     @Param("owner") String owner,
                     @Param("now") Instant now,
                     @Param("queued") ItemStatus queued,
                     @Param("running") ItemStatus running);

    default int releaseClaim(UUID id, String owner, Instant now) {
        return releaseClaim(id, owner, now, ItemStatus.QUEUED, ItemStatus.RUNNING);
    }

    /**
     * Fail items whose lease expired after the last allowed attempt.
     * These are abandoned by their callers and would otherwise stay RUNNING forever.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Item i
               SET i.status = :failed, i.error = :error, i.finishedAt = :now, i.updatedAt = :now,
                   i.claimOwner = null, i.claimExpiresAt = null
             WHERE i.jobId = :jobId AND i.status = :running
               AND i.claimExpiresAt < :now AND i.attempts >= :maxAttempts
            """)
    int expireAbandoned(@Param("jobId") UUID jobId,
                        @Param("maxAttempts") int maxAttempts,
                        @Param("error") String error,
                        @Param("now") Instant now,
                        @Param("failed") ItemStatus failed,
                        @Param("running") ItemStatus running);

    default int expireAbandoned(UUID jobId, int maxAttempts, Instant now) {
        return expireAbandoned(jobId, maxAttempts,
                "lease expired after " + maxAttempts + " attempts", now,
                ItemStatus.FAILED, ItemStatus.RUNNING);
    }
}
