package com.reelpipe.orchestrator.api.dto;

/** Request body for POST /documents/{documentId}/versions/{versionId}/regen. resumeChunks defaults to true. */
public record ChunkRegenRequest(Boolean resumeChunks) {

    public boolean resume() {
        return resumeChunks == null || resumeChunks;
    }
}
