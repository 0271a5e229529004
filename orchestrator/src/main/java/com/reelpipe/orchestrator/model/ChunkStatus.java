package com.reelpipe.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

public enum ChunkStatus {
    QUEUED,
    RUNNING,
    DONE,
    FAILED,
    FAILED_VALIDATION,
    NEEDS_REGEN;

    public static final Set<ChunkStatus> CLAIMABLE = EnumSet.of(QUEUED, NEEDS_REGEN);

    /** Exactly the chunks a partial regeneration puts back in the queue. */
    public static final Set<ChunkStatus> MISSING = EnumSet.of(FAILED, FAILED_VALIDATION, NEEDS_REGEN);

    public boolean isError() {
        return this == FAILED || this == FAILED_VALIDATION;
    }
}
