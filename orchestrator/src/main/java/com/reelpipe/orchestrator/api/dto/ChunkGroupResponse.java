package com.reelpipe.orchestrator.api.dto;

import com.reelpipe.orchestrator.service.ChunkGroup;

import java.util.List;

public record ChunkGroupResponse(String documentId,
                                 String versionId,
                                 boolean complete,
                                 int doneCount,
                                 List<ChunkGroup.ChunkView> chunks) {

    public static ChunkGroupResponse from(ChunkGroup group) {
        return new ChunkGroupResponse(group.documentId(), group.versionId(),
                group.isComplete(), group.doneCount(), group.chunks());
    }
}
