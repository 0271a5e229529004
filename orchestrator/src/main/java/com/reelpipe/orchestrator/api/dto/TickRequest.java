package com.reelpipe.orchestrator.api.dto;

/** Optional body for POST /jobs/{id}/tick; a missing limit uses the job policy. */
public record TickRequest(Integer maxItemsPerTick) {}
