package com.reelpipe.orchestrator.api.dto;

import com.reelpipe.orchestrator.model.Job;

import java.time.Instant;
import java.util.UUID;

/**
 * Job as returned by every job endpoint.
 *
 * {@code nextAction} tells a reloaded client what to do: "tick", "resume",
 * "awaiting-approval", "retry" or "none".
 */
public record JobResponse(
        UUID           id,
        String         kind,
        String         projectRef,
        String         format,
        String         status,
        int            totalCount,
        int            completedCount,
        int            errorCount,
        int            currentStageIndex,
        boolean        awaitingApproval,
        String         approvalRequiredFor,
        String         pendingArtifactRef,
        String         pauseReason,
        String         lastError,
        PolicyResponse policy,
        String         nextAction,
        Instant        createdAt,
        Instant        updatedAt,
        Instant        startedAt,
        Instant        finishedAt
) {
    public record PolicyResponse(boolean autoApprove, boolean stopOnFirstFail,
                                 int maxItemsPerTick, String rejectAction) {}

    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getKind().name(),
                job.getProjectRef(),
                job.getFormat(),
                job.getStatus().name(),
                job.getTotalCount(),
                job.getCompletedCount(),
                job.getErrorCount(),
                job.getCurrentStageIndex(),
                job.isAwaitingApproval(),
                job.getApprovalRequiredFor(),
                job.getPendingArtifactRef(),
                job.getPauseReason(),
                job.getLastError(),
                new PolicyResponse(
                        job.getPolicy().isAutoApprove(),
                        job.getPolicy().isStopOnFirstFail(),
                        job.getPolicy().getMaxItemsPerTick(),
                        job.getPolicy().getRejectAction().name()),
                nextAction(job),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getStartedAt(),
                job.getFinishedAt()
        );
    }

    static String nextAction(Job job) {
        return switch (job.getStatus()) {
            case QUEUED, RUNNING   -> "tick";
            case PAUSED            -> job.isAwaitingApproval() ? "awaiting-approval" : "resume";
            case FAILED            -> "retry";
            case COMPLETED, STOPPED -> "none";
        };
    }
}
