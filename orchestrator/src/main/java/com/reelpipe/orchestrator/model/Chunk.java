package com.reelpipe.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One independently generated slice of an oversized document version.
 *
 * Chunks of a (document_id, version_id) group have contiguous indices
 * starting at 0. The group is complete when every chunk is DONE.
 *
 * DB table: document_chunks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "document_chunks",
       uniqueConstraints = @UniqueConstraint(columnNames = {"document_id", "version_id", "chunk_index"}))
public class Chunk {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "document_id", nullable = false, length = 256, updatable = false)
    private String documentId;

    @Column(name = "version_id", nullable = false, length = 64, updatable = false)
    private String versionId;

    @Column(name = "chunk_index", nullable = false, updatable = false)
    private int chunkIndex;

    // "episodes-01-08" or "part-02"
    @Column(name = "chunk_key", nullable = false, length = 128, updatable = false)
    private String chunkKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ChunkStatus status = ChunkStatus.QUEUED;

    @Column(nullable = false)
    private int attempts = 0;

    @Column(name = "char_count", nullable = false)
    private int charCount = 0;

    @Column(length = 2000)
    private String error;

    @Column(name = "output_ref", length = 512)
    private String outputRef;

    @Column(name = "claim_owner", length = 64)
    private String claimOwner;

    @Column(name = "claim_key", length = 64)
    private String claimKey;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "claim_expires_at")
    private Instant claimExpiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Chunk() {}   // required by JPA

    public Chunk(String documentId, String versionId, int chunkIndex, String chunkKey) {
        this.documentId = documentId;
        this.versionId  = versionId;
        this.chunkIndex = chunkIndex;
        this.chunkKey   = chunkKey;
    }

    public UUID        getId()          { return id; }
    public String      getDocumentId()  { return documentId; }
    public String      getVersionId()   { return versionId; }
    public int         getChunkIndex()  { return chunkIndex; }
    public String      getChunkKey()    { return chunkKey; }
    public ChunkStatus getStatus()      { return status; }
    public int         getAttempts()    { return attempts; }
    public int         getCharCount()   { return charCount; }
    public String      getError()       { return error; }
    public String      getOutputRef()   { return outputRef; }
    public String      getClaimOwner()  { return claimOwner; }

    public void setStatus(ChunkStatus status) { this.status = status; }
    public void setError(String error)        { this.error = error; }

    /** Put the chunk back in the queue: attempts reset, lease and error cleared. */
    public void requeue() {
        this.status         = ChunkStatus.QUEUED;
        this.attempts       = 0;
        this.error          = null;
        this.claimOwner     = null;
        this.claimKey       = null;
        this.claimedAt      = null;
        this.claimExpiresAt = null;
    }
}
