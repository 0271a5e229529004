package com.reelpipe.orchestrator.driver;

import com.reelpipe.orchestrator.api.dto.JobResponse;
import com.reelpipe.orchestrator.api.dto.TickResponse;
import com.reelpipe.orchestrator.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one job by issuing ticks until the job reports done.
 *
 * The loop's own state is only a view; the job's persisted status is the
 * authority. A loop can be dropped at any moment and a new one started
 * later: ticks skip items that are already done, so nothing runs twice.
 *
 * Timing:
 * <ul>
 *   <li>after a tick that processed something, wait initialBackoff</li>
 *   <li>after a tick that processed nothing, grow the wait by backoffFactor up to maxBackoff</li>
 *   <li>after a transient transport failure, wait transientRetryDelay and tick again</li>
 * </ul>
 * Only an authoritative completed, failed, paused or stopped status, or a
 * non-transient transport failure, ends the loop.
 */
public class RunLoop {

    private static final Logger log = LoggerFactory.getLogger(RunLoop.class);

    public enum State { IDLE, RUNNING, PAUSED, COMPLETE, FAILED }

    private final UUID                      jobId;
    private final TickClient                client;
    private final PipelineProperties.Driver settings;
    private final Sleeper                   sleeper;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean      abort;
    private volatile State        state = State.IDLE;
    private volatile TickResponse lastTick;
    private volatile String       lastError;
    private volatile int          ticks;

    public RunLoop(UUID jobId, TickClient client, PipelineProperties.Driver settings, Sleeper sleeper) {
        this.jobId    = jobId;
        this.client   = client;
        this.settings = settings;
        this.sleeper  = sleeper;
    }

    /**
     * Tick until done, aborted, or a non-transient failure.
     * Calling run on a loop that is already running returns its current state.
     */
    public State run() {
        if (!running.compareAndSet(false, true)) {
            return state;
        }
        abort = false;
        state = State.RUNNING;
        lastError = null;
        MDC.put("jobId", jobId.toString());
        try {
            loop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Run loop for job {} interrupted", jobId);
            if (state == State.RUNNING) {
                state = State.IDLE;
            }
        } finally {
            running.set(false);
            MDC.remove("jobId");
        }
        return state;
    }

    private void loop() throws InterruptedException {
        Duration backoff = settings.initialBackoff();
        Integer limit = settings.maxItemsPerTick() > 0 ? settings.maxItemsPerTick() : null;

        while (!abort) {
            TickResponse tick;
            try {
                tick = client.tick(jobId, limit);
                ticks++;
            } catch (TickClientException e) {
                if (!e.isTransient()) {
                    log.error("Run loop for job {} stopped: {}", jobId, e.getMessage());
                    lastError = e.getMessage();
                    state = State.FAILED;
                    return;
                }
                log.warn("Tick for job {} failed transiently, retrying in {}: {}",
                        jobId, settings.transientRetryDelay(), e.getMessage());
                sleeper.sleep(settings.transientRetryDelay());
                continue;
            }

            lastTick = tick;
            if (abort) {
                return;
            }
            if (tick.done()) {
                state = stateOf(tick.job());
                log.info("Run loop for job {} finished after {} tick(s): {} ({}/{})", jobId, ticks,
                        tick.job().status(), tick.job().completedCount(), tick.job().totalCount());
                return;
            }

            backoff = tick.processedCount() > 0 ? settings.initialBackoff() : grow(backoff);
            sleeper.sleep(backoff);
        }
    }

    /** Persist PAUSED first, then stop issuing ticks. */
    public State pause() {
        JobResponse job = client.pause(jobId);
        abort = true;
        state = stateOf(job);
        return state;
    }

    /** Persist STOPPED first, then stop issuing ticks. */
    public State stop() {
        JobResponse job = client.stop(jobId);
        abort = true;
        state = stateOf(job);
        return state;
    }

    /** Persist RUNNING and tick on from the current progress. Blocks like {@link #run()}. */
    public State resume() {
        client.resume(jobId);
        return run();
    }

    /** Stop issuing ticks without touching the persisted status. */
    public void abort() {
        abort = true;
    }

    public boolean isRunning() {
        return running.get();
    }

    public State state() {
        return state;
    }

    public TickResponse lastTick() {
        return lastTick;
    }

    public String lastError() {
        return lastError;
    }

    public int ticks() {
        return ticks;
    }

    public UUID jobId() {
        return jobId;
    }

    private Duration grow(Duration current) {
        long next = (long) (current.toMillis() * settings.backoffFactor());
        return Duration.ofMillis(Math.min(next, settings.maxBackoff().toMillis()));
    }

    static State stateOf(JobResponse job) {
        return switch (job.status()) {
            case "COMPLETED" -> State.COMPLETE;
            case "FAILED"    -> State.FAILED;
            case "PAUSED"    -> State.PAUSED;
            case "STOPPED"   -> State.IDLE;
            default          -> State.RUNNING;
        };
    }
}
