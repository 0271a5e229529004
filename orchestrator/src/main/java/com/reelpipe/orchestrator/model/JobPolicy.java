package com.reelpipe.orchestrator.model;

import jakarta.persistence.*;

/**
 * Execution policy fixed at job start and stored on the job row.
 */
@Embeddable
public class JobPolicy {

    @Column(name = "auto_approve", nullable = false)
    private boolean autoApprove = false;

    @Column(name = "stop_on_first_fail", nullable = false)
    private boolean stopOnFirstFail = false;

    @Column(name = "max_items_per_tick", nullable = false)
    private int maxItemsPerTick = 1;

    @Enumerated(EnumType.STRING)
    @Column(name = "reject_action", nullable = false, length = 32)
    private RejectAction rejectAction = RejectAction.REGENERATE;

    protected JobPolicy() {}   // required by JPA

    public JobPolicy(boolean autoApprove, boolean stopOnFirstFail,
                     int maxItemsPerTick, RejectAction rejectAction) {
        if (maxItemsPerTick < 1) {
            throw new IllegalArgumentException("maxItemsPerTick must be >= 1, got " + maxItemsPerTick);
        }
        this.autoApprove     = autoApprove;
        this.stopOnFirstFail = stopOnFirstFail;
        this.maxItemsPerTick = maxItemsPerTick;
        this.rejectAction    = rejectAction == null ? RejectAction.REGENERATE : rejectAction;
    }

    public static JobPolicy defaults() {
        return new JobPolicy(false, false, 1, RejectAction.REGENERATE);
    }

    public boolean      isAutoApprove()     { return autoApprove; }
    public boolean      isStopOnFirstFail() { return stopOnFirstFail; }
    public int          getMaxItemsPerTick(){ return maxItemsPerTick; }
    public RejectAction getRejectAction()   { return rejectAction; }
}
