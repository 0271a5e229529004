package com.reelpipe.orchestrator.model;

/**
 * What a job generates. The kind decides how items are materialized at start.
 */
public enum JobKind {
    DOCUMENT_AUTORUN,   // one item per ladder stage
    EPISODE_SCRIPTS,    // one item per episode
    TRAILER_CLIPS,      // one item per clip key
    TRAILER_AUDIO,      // one item per audio cue
    TRAILER_RENDER,     // one item per render target
    CHUNK_REGEN;        // internal: one item per re-enqueued chunk

    public boolean isInternal() {
        return this == CHUNK_REGEN;
    }
}
