package com.reelpipe.orchestrator.service;

import com.reelpipe.orchestrator.model.Item;
import com.reelpipe.orchestrator.model.ItemStatus;
import com.reelpipe.orchestrator.model.Job;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Progress and ETA from item timestamps. Pure: no I/O, no state.
 *
 * Average step time is the mean gap between consecutive completion
 * timestamps. With fewer than two completions there is no gap to measure,
 * so the average falls back to elapsed / completed and no ETA is reported.
 */
@Component
public class ProgressEstimator {

    static final int MIN_SAMPLES_FOR_ETA = 2;

    public Progress estimate(Job job, List<Item> items, Instant now) {
        int total     = items.size();
        int completed = (int) items.stream().filter(i -> i.getStatus().isSettled()).count();
        int errors    = (int) items.stream().filter(i -> i.getStatus().isError()).count();
        int remaining = (int) items.stream().filter(i -> i.getStatus().isOpen()).count();
        long elapsedMs = Math.max(0, Duration.between(job.getCreatedAt(), now).toMillis());

        List<Instant> finished = items.stream()
                .filter(i -> i.getStatus() == ItemStatus.DONE)
                .map(Item::getFinishedAt)
                .filter(Objects::nonNull)
                .sorted()
                .toList();

        long avgStepMs;
        Long etaMs = null;
        if (finished.size() >= MIN_SAMPLES_FOR_ETA) {
            long spanMs = Duration.between(finished.get(0), finished.get(finished.size() - 1)).toMillis();
            avgStepMs = spanMs / (finished.size() - 1);
            etaMs = avgStepMs * remaining;
        } else {
            avgStepMs = elapsedMs / Math.max(1, completed);
        }

        int percent = total == 0 ? 0 : (int) Math.round(completed * 100.0 / total);
        return new Progress(total, completed, errors, remaining, percent, elapsedMs, avgStepMs, etaMs);
    }
}
