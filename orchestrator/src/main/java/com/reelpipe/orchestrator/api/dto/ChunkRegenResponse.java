package com.reelpipe.orchestrator.api.dto;

import com.reelpipe.orchestrator.service.JobService;

import java.util.List;
import java.util.UUID;

public record ChunkRegenResponse(String documentId, String versionId, List<Integer> enqueuedIndices, UUID jobId) {

    public static ChunkRegenResponse from(JobService.ChunkRegenOutcome outcome) {
        return new ChunkRegenResponse(outcome.documentId(), outcome.versionId(), outcome.enqueuedIndices(),
                outcome.job() == null ? null : outcome.job().getId());
    }
}
