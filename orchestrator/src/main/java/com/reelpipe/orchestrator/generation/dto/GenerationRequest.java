package com.reelpipe.orchestrator.generation.dto;

/**
 * Body of POST /generate.
 *
 * {@code chunkKey} is null for whole-unit calls. {@code episodeFrom}/{@code episodeTo}
 * are 0 when the unit is not an episode range.
 */
public record GenerationRequest(
        String idempotencyKey,
        String jobKind,
        String projectRef,
        String format,
        String stageKey,
        String unitKey,
        int    revision,
        String inputRef,
        String chunkKey,
        int    episodeFrom,
        int    episodeTo
) {
    public boolean coversEpisodes() {
        return episodeFrom > 0 && episodeTo >= episodeFrom;
    }
}
