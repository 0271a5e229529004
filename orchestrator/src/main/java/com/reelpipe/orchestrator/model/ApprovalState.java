package com.reelpipe.orchestrator.model;

public enum ApprovalState {
    REQUESTED,
    APPROVED,
    REJECTED
}
