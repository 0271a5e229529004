package com.reelpipe.orchestrator.api.dto;

import java.util.List;
import java.util.UUID;

/** Response body for POST /jobs. */
public record StartJobResponse(UUID jobId, int totalCount, JobResponse job, List<ItemResponse> items) {}
