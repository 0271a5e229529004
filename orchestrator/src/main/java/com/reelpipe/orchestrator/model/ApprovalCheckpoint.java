package com.reelpipe.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit record of one approval request at a gated stage and its outcome.
 *
 * DB table: approval_checkpoints  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "approval_checkpoints")
public class ApprovalCheckpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "item_id", nullable = false, updatable = false)
    private UUID itemId;

    @Column(name = "stage_key", nullable = false, length = 128, updatable = false)
    private String stageKey;

    // Item revision the proposal belongs to; a rejected revision is never re-requested.
    @Column(nullable = false, updatable = false)
    private int revision;

    @Column(name = "pending_artifact_ref", length = 512)
    private String pendingArtifactRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ApprovalState state = ApprovalState.REQUESTED;

    @Column(name = "requested_at", nullable = false, updatable = false)
    private Instant requestedAt;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(length = 2000)
    private String note;

    protected ApprovalCheckpoint() {}   // required by JPA

    public ApprovalCheckpoint(UUID jobId, Item item, Instant requestedAt) {
        this.jobId              = jobId;
        this.itemId             = item.getId();
        this.stageKey           = item.getUnitKey();
        this.revision           = item.getRevision();
        this.pendingArtifactRef = item.getOutputRef();
        this.requestedAt        = requestedAt;
    }

    public UUID          getId()                 { return id; }
    public UUID          getJobId()              { return jobId; }
    public UUID          getItemId()             { return itemId; }
    public String        getStageKey()           { return stageKey; }
    public int           getRevision()           { return revision; }
    public String        getPendingArtifactRef() { return pendingArtifactRef; }
    public ApprovalState getState()              { return state; }
    public Instant       getRequestedAt()        { return requestedAt; }
    public Instant       getDecidedAt()          { return decidedAt; }
    public String        getNote()               { return note; }

    public void decide(boolean approved, String note, Instant decidedAt) {
        if (state != ApprovalState.REQUESTED) {
            throw new IllegalStateException("Checkpoint " + id + " already " + state);
        }
        this.state     = approved ? ApprovalState.APPROVED : ApprovalState.REJECTED;
        this.note      = note;
        this.decidedAt = decidedAt;
    }
}
