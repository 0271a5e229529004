package com.reelpipe.orchestrator.api.dto;

/** Request body for POST /jobs/{id}/decisions. */
public record DecisionRequest(String stageKey, Boolean approved, String note) {}
