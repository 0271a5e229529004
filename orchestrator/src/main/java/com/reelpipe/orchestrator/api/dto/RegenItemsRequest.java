package com.reelpipe.orchestrator.api.dto;

import java.util.List;
import java.util.UUID;

/** Request body for POST /jobs/{id}/items/regen; no ids = every FAILED_VALIDATION item. */
public record RegenItemsRequest(List<UUID> itemIds) {}
