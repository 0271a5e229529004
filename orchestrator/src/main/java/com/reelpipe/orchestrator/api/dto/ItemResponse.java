package com.reelpipe.orchestrator.api.dto;

import com.reelpipe.orchestrator.model.Item;

import java.time.Instant;
import java.util.UUID;

public record ItemResponse(
        UUID    id,
        int     index,
        String  stageKey,
        String  unitKey,
        String  status,
        int     attempts,
        int     revision,
        String  error,
        String  outputRef,
        String  pinnedRef,
        boolean requiresApproval,
        boolean gatePassed,
        Integer chunkIndex,
        Instant startedAt,
        Instant finishedAt
) {
    public static ItemResponse from(Item item) {
        return new ItemResponse(
                item.getId(),
                item.getItemIndex(),
                item.getStageKey(),
                item.getUnitKey(),
                item.getStatus().name(),
                item.getAttempts(),
                item.getRevision(),
                item.getError(),
                item.getOutputRef(),
                item.getPinnedRef(),
                item.isRequiresApproval(),
                item.isGatePassed(),
                item.getChunkIndex(),
                item.getStartedAt(),
                item.getFinishedAt()
        );
    }
}
