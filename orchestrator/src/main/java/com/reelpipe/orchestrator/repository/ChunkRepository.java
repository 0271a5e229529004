package com.reelpipe.orchestrator.repository;

import com.reelpipe.orchestrator.model.Chunk;
import com.reelpipe.orchestrator.model.ChunkStatus;
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
 * Chunk group storage. Claim and result writes mirror ItemRepository.
 */
public interface ChunkRepository extends JpaRepository<Chunk, UUID> {

    List<Chunk> findByDocumentIdAndVersionIdOrderByChunkIndexAsc(String documentId, String versionId);

    Optional<Chunk> findByDocumentIdAndVersionIdAndChunkIndex(String documentId, String versionId, int chunkIndex);

    long countByDocumentIdAndVersionId(String documentId, String versionId);

    @Query("""
            SELECT c FROM Chunk c
            WHERE c.documentId = :documentId AND c.versionId = :versionId
              AND c.attempts < :maxAttempts
              AND (c.status IN :claimable OR (c.status = :running AND c.claimExpiresAt < :now))
            ORDER BY c.chunkIndex ASC
            """)
    List<Chunk> findClaimCandidates(@Param("documentId") String documentId,
                                    @Param("versionId") String versionId,
                                    @Param("maxAttempts") int maxAttempts,
                                    @Param("claimable") Collection<ChunkStatus> claimable,
                                    @Param("running") ChunkStatus running,
                                    @Param("now") Instant now);

    default List<Chunk> findClaimCandidates(String documentId, String versionId, int maxAttempts, Instant now) {
        return findClaimCandidates(documentId, versionId, maxAttempts,
                ChunkStatus.CLAIMABLE, ChunkStatus.RUNNING, now);
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Chunk c
               SET c.status = :running, c.claimOwner = :owner, c.claimKey = :claimKey,
                   c.claimedAt = :now, c.claimExpiresAt = :expiresAt,
                   c.attempts = c.attempts + 1, c.updatedAt = :now
             WHERE c.id = :id
               AND c.attempts < :maxAttempts
               AND (c.status IN :claimable OR (c.status = :running AND c.claimExpiresAt < :now))
            """)
    int tryClaim(@Param("id") UUID id,
                 @Param("owner") String owner,
                 @Param("claimKey") String claimKey,
                 @Param("now") Instant now,
                 @Param("expiresAt") Instant expiresAt,
                 @Param("maxAttempts") int maxAttempts,
                 @Param("claimable") Collection<ChunkStatus> claimable,
                 @Param("running") ChunkStatus running);

    default int tryClaim(UUID id, String owner, String claimKey, Instant now, Instant expiresAt, int maxAttempts) {
        return tryClaim(id, owner, claimKey, now, expiresAt, maxAttempts, ChunkStatus.CLAIMABLE, ChunkStatus.RUNNING);
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Chunk c
               SET c.status = :done, c.outputRef = :outputRef, c.charCount = :charCount,
                   c.error = null, c.attempts = 0, c.updatedAt = :now,
                   c.claimOwner = null, c.claimExpiresAt = null
             WHERE c.id = :id AND c.status = :running AND c.claimOwner = :owner
            """)
    int completeClaim(@Param("id") UUID id,
                      @Param("owner") String owner,
                      @Param("outputRef") String outputRef,
                      @Param("charCount") int charCount,
                      @Param("now") Instant now,
                      @Param("done") ChunkStatus done,
                      @Param("running") ChunkStatus running);

    default int completeClaim(UUID id, String owner, String outputRef, int charCount, Instant now) {
        return completeClaim(id, owner, outputRef, charCount, now, ChunkStatus.DONE, ChunkStatus.RUNNING);
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Chunk c
               SET c.status = :status, c.error = :error, c.updatedAt = :now,
                   c.claimOwner = null, c.claimExpiresAt = null
             WHERE c.id = :id AND c.status = :running AND c.claimOwner = :owner
            """)
    int failClaim(@Param("id") UUID id,
                  @Param("owner") String owner,
                  @Param("status") ChunkStatus status,
                  @Param("error") String error,
                  @Param("now") Instant now,
                  @Param("running") ChunkStatus running);

    default int failClaim(UUID id, String owner, ChunkStatus status, String error, Instant now) {
        return failClaim(id, owner, status, error, now, ChunkStatus.RUNNING);
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Chunk c
               SET c.status = :failed, c.error = :error, c.updatedAt = :now,
                   c.claimOwner = null, c.claimExpiresAt = null
             WHERE c.documentId = :documentId AND c.versionId = :versionId
               AND c.status = :running AND c.claimExpiresAt < :now AND c.attempts >= :maxAttempts
            """)
    int expireAbandoned(@Param("documentId") String documentId,
                        @Param("versionId") String versionId,
                        @Param("maxAttempts") int maxAttempts,
                        @Param("error") String error,
                        @Param("now") Instant now,
                        @Param("failed") ChunkStatus failed,
                        @Param("running") ChunkStatus running);

    default int expireAbandoned(String documentId, String versionId, int maxAttempts, Instant now) {
        return expireAbandoned(documentId, versionId, maxAttempts,
                "lease expired after " + maxAttempts + " attempts", now,
                ChunkStatus.FAILED, ChunkStatus.RUNNING);
    }
}
