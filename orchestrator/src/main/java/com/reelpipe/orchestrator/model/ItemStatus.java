package com.reelpipe.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-item state.
 *
 * FAILED_VALIDATION and NEEDS_REGEN are kept apart from FAILED: they are
 * recovered through targeted regeneration, not a whole-job retry.
 */
public enum ItemStatus {
    QUEUED,
    RUNNING,
    DONE,
    FAILED,
    FAILED_VALIDATION,
    NEEDS_REGEN,
    SKIPPED;

    /** States a claim may start from (RUNNING additionally needs an expired lease). */
    public static final Set<ItemStatus> CLAIMABLE = EnumSet.of(QUEUED, NEEDS_REGEN);

    public static final Set<ItemStatus> ERRORS = EnumSet.of(FAILED, FAILED_VALIDATION);

    /** Still has work left. A job with no open items is finished. */
    public boolean isOpen() {
        return this == QUEUED || this == RUNNING || this == NEEDS_REGEN;
    }

    public boolean isError() {
        return ERRORS.contains(this);
    }

    /** Counted in completed_count. */
    public boolean isSettled() {
        return this == DONE || this == SKIPPED;
    }
}
