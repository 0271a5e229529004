package com.reelpipe.orchestrator.service;

import com.reelpipe.orchestrator.model.Item;
import com.reelpipe.orchestrator.model.ItemStatus;
import com.reelpipe.orchestrator.model.Job;
import com.reelpipe.orchestrator.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Derives a job's counters and follow-up status from its items.
 *
 * Callers hold the job row lock (JobRepository#findByIdForUpdate) and pass
 * a fresh item list, so counters are always a function of item state.
 */
@Component
public class JobReconciler {

    private static final Logger log = LoggerFactory.getLogger(JobReconciler.class);

    private final Clock clock;

    public JobReconciler(Clock clock) {
        this.clock = clock;
    }

    /**
     * Steps:
     *  1. Recount total / completed (DONE + SKIPPED) / errors (FAILED + FAILED_VALIDATION)
     *  2. current_stage_index = lowest open item, or total when nothing is open
     *  3. A RUNNING job with no open items is COMPLETED (errors included),
     *     unless a finished gated item still waits for its decision
     *  4. A RUNNING job whose open items all sit behind a failed gated item is PAUSED
     */
    public void reconcile(Job job, List<Item> items) {
        int total     = items.size();
        int completed = (int) items.stream().filter(i -> i.getStatus().isSettled()).count();
        int errors    = (int) items.stream().filter(i -> i.getStatus().isError()).count();
        job.setCounters(total, completed, errors);

        Optional<Item> firstOpen = items.stream()
                .filter(i -> i.getStatus().isOpen())
                .min(Comparator.comparingInt(Item::getItemIndex));
        job.setCurrentStageIndex(firstOpen.map(Item::getItemIndex).orElse(total));

        if (job.getStatus() != JobStatus.RUNNING) {
            return;
        }
        if (firstOpen.isEmpty()) {
            Optional<Item> undecided = undecidedGate(items);
            if (undecided.isPresent()) {
                log.debug("Job {} has nothing open but stage {} has no approval yet; not completing",
                        job.getId(), undecided.get().getUnitKey());
                return;
            }
            job.setStatus(JobStatus.COMPLETED);
            job.setFinishedAt(clock.instant());
            log.info("Job {} COMPLETED ({} done, {} failed of {})", job.getId(), completed, errors, total);
            return;
        }
        failedGate(items).ifPresent(gate -> {
            if (firstOpen.get().getItemIndex() > gate.getItemIndex()) {
                job.setStatus(JobStatus.PAUSED);
                job.setPauseReason("gated stage " + gate.getStageKey() + " is " + gate.getStatus()
                        + "; retry or regenerate it to continue");
                log.warn("Job {} PAUSED: gated stage {} is {}", job.getId(), gate.getStageKey(), gate.getStatus());
            }
        });
    }

    // A gated item that produced its output but was never approved.
    private static Optional<Item> undecidedGate(List<Item> items) {
        return items.stream()
                .filter(i -> i.isRequiresApproval() && !i.isGatePassed() && i.getStatus() == ItemStatus.DONE)
                .min(Comparator.comparingInt(Item::getItemIndex));
    }

    // The lowest unpassed gate, if its item ended in an error state.
    private static Optional<Item> failedGate(List<Item> items) {
        return items.stream()
                .filter(i -> i.isRequiresApproval() && !i.isGatePassed())
                .min(Comparator.comparingInt(Item::getItemIndex))
                .filter(i -> i.getStatus().isError());
    }
}
