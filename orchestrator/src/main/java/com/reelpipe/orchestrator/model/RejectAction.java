package com.reelpipe.orchestrator.model;

/** What a rejected approval does to the job. */
public enum RejectAction {
    /** Mark the gated item NEEDS_REGEN and keep the job running. */
    REGENERATE,
    /** Mark the gated item NEEDS_REGEN and leave the job paused. */
    PAUSE
}
