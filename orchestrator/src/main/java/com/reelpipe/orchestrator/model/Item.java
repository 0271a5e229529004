package com.reelpipe.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One unit of work inside a Job: a ladder stage, an episode, a trailer clip,
 * or a single document chunk.
 *
 * Items are executed in item_index order. The claim_* columns form the
 * lease written by ClaimProtocol; a lease whose claim_expires_at is in the
 * past may be taken over by another caller.
 *
 * DB table: job_items  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "job_items",
       uniqueConstraints = @UniqueConstraint(columnNames = {"job_id", "item_index"}))
public class Item {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Plain column rather than a relation: ticks only ever load items by job id.
    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "item_index", nullable = false, updatable = false)
    private int itemIndex;

    // Ladder stage (e.g. "treatment") or a fixed key for flat queues ("clip").
    @Column(name = "stage_key", nullable = false, length = 128)
    private String stageKey;

    // Human-readable unit label, e.g. "episode-03" or "clip-hook".
    @Column(name = "unit_key", nullable = false, length = 128)
    private String unitKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ItemStatus status = ItemStatus.QUEUED;

    // Claims without progress since the last requeue.
    @Column(nullable = false)
    private int attempts = 0;

    // Bumped when an approved-or-rejected artifact must be regenerated from scratch.
    @Column(nullable = false)
    private int revision = 1;

    @Column(length = 2000)
    private String error;

    @Column(name = "output_ref", length = 512)
    private String outputRef;

    // Set when the item passed an approval gate; later stages read this, not output_ref.
    @Column(name = "pinned_ref", length = 512)
    private String pinnedRef;

    @Column(name = "requires_approval", nullable = false)
    private boolean requiresApproval = false;

    @Column(name = "gate_passed", nullable = false)
    private boolean gatePassed = false;

    @Column(name = "estimated_chars", nullable = false)
    private int estimatedChars = 0;

    // Number of episodes this unit covers (0 when not episodic).
    @Column(name = "episode_span", nullable = false)
    private int episodeSpan = 0;

    // Chunk group coordinates. document_ref is set for every item;
    // version_ref and chunk_index only for chunk regeneration items.
    @Column(name = "document_ref", length = 256)
    private String documentRef;

    @Column(name = "version_ref", length = 64)
    private String versionRef;

    @Column(name = "chunk_index")
    private Integer chunkIndex;

    // Lease
    @Column(name = "claim_owner", length = 64)
    private String claimOwner;

    @Column(name = "claim_key", length = 64)
    private String claimKey;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "claim_expires_at")
    private Instant claimExpiresAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Item() {}   // required by JPA

    public Item(UUID jobId, int itemIndex, String stageKey, String unitKey) {
        this.jobId     = jobId;
        this.itemIndex = itemIndex;
        this.stageKey  = stageKey;
        this.unitKey   = unitKey;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID       getId()             { return id; }
    public UUID       getJobId()          { return jobId; }
    public int        getItemIndex()      { return itemIndex; }
    public String     getStageKey()       { return stageKey; }
    public String     getUnitKey()        { return unitKey; }
    public ItemStatus getStatus()         { return status; }
    public int        getAttempts()       { return attempts; }
    public int        getRevision()       { return revision; }
    public String     getError()          { return error; }
    public String     getOutputRef()      { return outputRef; }
    public String     getPinnedRef()      { return pinnedRef; }
    public boolean    isRequiresApproval(){ return requiresApproval; }
    public boolean    isGatePassed()      { return gatePassed; }
    public int        getEstimatedChars() { return estimatedChars; }
    public int        getEpisodeSpan()    { return episodeSpan; }
    public String     getDocumentRef()    { return documentRef; }
    public Integer    getChunkIndex()     { return chunkIndex; }
    public String     getClaimOwner()     { return claimOwner; }
    public String     getClaimKey()       { return claimKey; }
    public Instant    getClaimedAt()      { return claimedAt; }
    public Instant    getClaimExpiresAt() { return claimExpiresAt; }
    public Instant    getStartedAt()      { return startedAt; }
    public Instant    getFinishedAt()     { return finishedAt; }
    public Instant    getCreatedAt()      { return createdAt; }

    public void setStatus(ItemStatus status)            { this.status = status; }
    public void setError(String error)                  { this.error = error; }
    public void setOutputRef(String outputRef)          { this.outputRef = outputRef; }
    public void setRequiresApproval(boolean v)          { this.requiresApproval = v; }
    public void setGatePassed(boolean v)                { this.gatePassed = v; }
    public void setEstimatedChars(int v)                { this.estimatedChars = v; }
    public void setEpisodeSpan(int v)                   { this.episodeSpan = v; }
    public void setDocumentRef(String documentRef)      { this.documentRef = documentRef; }
    public void setFinishedAt(Instant finishedAt)       { this.finishedAt = finishedAt; }

    /** Target a single chunk of an existing chunk group. */
    public void targetChunk(String documentRef, String versionRef, int chunkIndex) {
        this.documentRef = documentRef;
        this.versionRef  = versionRef;
        this.chunkIndex  = chunkIndex;
    }

    /**
     * Chunk group version for this item. Regular items derive it from the
     * revision, so a regenerated revision starts a fresh group while a plain
     * retry reuses the chunks already done.
     */
    public String getVersionRef() {
        return versionRef != null ? versionRef : "r" + revision;
    }

    public boolean targetsSingleChunk() {
        return chunkIndex != null;
    }

    /** Approve the current output: later stages read it from pinned_ref. */
    public void pinOutput() {
        this.pinnedRef  = outputRef;
        this.gatePassed = true;
    }

    /** Finished outside a claim, from output assembled elsewhere. */
    public void settleDone(String outputRef, Instant now) {
        this.status     = ItemStatus.DONE;
        this.outputRef  = outputRef;
        this.error      = null;
        this.finishedAt = now;
        clearClaim();
    }

    /** Back to the queue with a clean slate. The revision is kept. */
    public void requeue() {
        this.status     = ItemStatus.QUEUED;
        this.attempts   = 0;
        this.error      = null;
        this.finishedAt = null;
        clearClaim();
    }

    /** Discard the current artifact and ask for a fresh one under a new revision. */
    public void markNeedsRegen(String reason) {
        this.status     = ItemStatus.NEEDS_REGEN;
        this.revision   = revision + 1;
        this.attempts   = 0;
        this.error      = reason;
        this.outputRef  = null;
        this.pinnedRef  = null;
        this.gatePassed = false;
        this.finishedAt = null;
        clearClaim();
    }

    private void clearClaim() {
        this.claimOwner     = null;
        this.claimKey       = null;
        this.claimedAt      = null;
        this.claimExpiresAt = null;
    }
}
