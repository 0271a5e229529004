package com.reelpipe.orchestrator.service;

/**
 * Derived progress of a job at one instant.
 *
 * @param avgStepMs average time per completed item
 * @param etaMs     null until at least two items have completed
 */
public record Progress(int totalCount,
                       int completedCount,
                       int errorCount,
                       int remainingCount,
                       int percent,
                       long elapsedMs,
                       long avgStepMs,
                       Long etaMs) {}
