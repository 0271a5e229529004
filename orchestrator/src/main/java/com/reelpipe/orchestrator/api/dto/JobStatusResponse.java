package com.reelpipe.orchestrator.api.dto;

import com.reelpipe.orchestrator.service.Progress;

import java.util.List;

/** Full job view for GET /jobs/{id} and GET /jobs/latest, enough to resume after a reload. */
public record JobStatusResponse(JobResponse job, List<ItemResponse> items, Progress progress) {}
