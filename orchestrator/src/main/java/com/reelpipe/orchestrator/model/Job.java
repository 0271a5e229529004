package com.reelpipe.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One long-running generation run: a document autorun, an episode batch,
 * a trailer queue, or a chunk regeneration.
 *
 * The job row holds status, policy and aggregated counters. Counters are
 * always recomputed from item rows (see JobService#refreshProgress), never
 * incremented in place.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private JobKind kind;

    @Column(name = "project_ref", nullable = false)
    private String projectRef;

    // Normalized format slug, e.g. "film" or "vertical-drama".
    @Column(nullable = false, length = 64)
    private String format;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private JobStatus status = JobStatus.QUEUED;

    @Embedded
    private JobPolicy policy = JobPolicy.defaults();

    @Column(name = "total_count", nullable = false)
    private int totalCount = 0;

    @Column(name = "completed_count", nullable = false)
    private int completedCount = 0;

    @Column(name = "error_count", nullable = false)
    private int errorCount = 0;

    // Index of the lowest item that still has work; equals total_count when none.
    @Column(name = "current_stage_index", nullable = false)
    private int currentStageIndex = 0;

    // Approval gate state. awaiting_approval implies status = PAUSED.
    @Column(name = "awaiting_approval", nullable = false)
    private boolean awaitingApproval = false;

    @Column(name = "approval_required_for", length = 128)
    private String approvalRequiredFor;

    @Column(name = "pending_artifact_ref", length = 512)
    private String pendingArtifactRef;

    @Column(name = "pause_reason", length = 512)
    private String pauseReason;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // Called automatically by JPA before every UPDATE.
    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(JobKind kind, String projectRef, String format, JobPolicy policy, Instant createdAt) {
        this.kind       = kind;
        this.projectRef = projectRef;
        this.format     = format;
        this.policy     = policy == null ? JobPolicy.defaults() : policy;
        this.createdAt  = createdAt;
        this.updatedAt  = createdAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID      getId()                  { return id; }
    public JobKind   getKind()                { return kind; }
    public String    getProjectRef()          { return projectRef; }
    public String    getFormat()              { return format; }
    public JobStatus getStatus()              { return status; }
    public JobPolicy getPolicy()              { return policy; }
    public int       getTotalCount()          { return totalCount; }
    public int       getCompletedCount()      { return completedCount; }
    public int       getErrorCount()          { return errorCount; }
    public int       getCurrentStageIndex()   { return currentStageIndex; }
    public boolean   isAwaitingApproval()     { return awaitingApproval; }
    public String    getApprovalRequiredFor() { return approvalRequiredFor; }
    public String    getPendingArtifactRef()  { return pendingArtifactRef; }
    public String    getPauseReason()         { return pauseReason; }
    public String    getLastError()           { return lastError; }
    public Instant   getCreatedAt()           { return createdAt; }
    public Instant   getUpdatedAt()           { return updatedAt; }
    public Instant   getStartedAt()           { return startedAt; }
    public Instant   getFinishedAt()          { return finishedAt; }

    public void setStatus(JobStatus status)            { this.status = status; }
    public void setPauseReason(String pauseReason)     { this.pauseReason = pauseReason; }
    public void setLastError(String lastError)         { this.lastError = lastError; }
    public void setStartedAt(Instant startedAt)        { this.startedAt = startedAt; }
    public void setFinishedAt(Instant finishedAt)      { this.finishedAt = finishedAt; }
    public void setCurrentStageIndex(int v)            { this.currentStageIndex = v; }

    /** Overwrites all three counters at once; callers pass values derived from item rows. */
    public void setCounters(int total, int completed, int errors) {
        if (completed > total) {
            throw new IllegalStateException(
                    "completed_count " + completed + " exceeds total_count " + total + " for job " + id);
        }
        this.totalCount     = total;
        this.completedCount = completed;
        this.errorCount     = errors;
    }

    /** Enter the approval gate for a stage: job pauses until a decision is recorded. */
    public void awaitApproval(String stageKey, String artifactRef) {
        this.status              = JobStatus.PAUSED;
        this.awaitingApproval    = true;
        this.approvalRequiredFor = stageKey;
        this.pendingArtifactRef  = artifactRef;
        this.pauseReason         = "awaiting approval for " + stageKey;
    }

    public void clearApproval() {
        this.awaitingApproval    = false;
        this.approvalRequiredFor = null;
        this.pendingArtifactRef  = null;
    }
}
