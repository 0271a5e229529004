package com.reelpipe.orchestrator.driver;

import com.reelpipe.orchestrator.api.dto.JobResponse;
import com.reelpipe.orchestrator.api.dto.TickResponse;
import com.reelpipe.orchestrator.config.PipelineProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for RunLoop with a scripted tick client and a sleeper that only
 * records the requested delays.
 */
class RunLoopTest {

    private static final UUID JOB_ID = UUID.randomUUID();

    private final PipelineProperties.Driver settings = new PipelineProperties.Driver(
            false, 1, Duration.ofMillis(1000), Duration.ofMillis(2000), 1.5, Duration.ofMillis(3000), 0);

    private final ScriptedClient client  = new ScriptedClient();
    private final List<Duration> sleeps  = new ArrayList<>();
    private final RunLoop        loop    = new RunLoop(JOB_ID, client, settings, sleeps::add);

    @Test
    void ticksUntilCompleted() {
        client.then(tick(false, "RUNNING", 1))
              .then(tick(false, "RUNNING", 1))
              .then(tick(true, "COMPLETED", 1));

        RunLoop.State end = loop.run();

        assertThat(end).isEqualTo(RunLoop.State.COMPLETE);
        assertThat(loop.ticks()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(1000), Duration.ofMillis(1000));
    }

    @Test
    void noProgressTicks_growBackoffUpToTheCap() {
        client.then(tick(false, "RUNNING", 0))
              .then(tick(false, "RUNNING", 0))
              .then(tick(false, "RUNNING", 0))
              .then(tick(false, "RUNNING", 1))
              .then(tick(true, "COMPLETED", 1));

        loop.run();

        assertThat(sleeps).containsExactly(
                Duration.ofMillis(1500), Duration.ofMillis(2000), Duration.ofMillis(2000), Duration.ofMillis(1000));
    }

    @Test
    void transientFailure_isRetriedAfterFixedDelay() {
        client.then(new TickClientException("connection refused", true))
              .then(new TickClientException("HTTP 502", true))
              .then(tick(true, "COMPLETED", 1));

        RunLoop.State end = loop.run();

        assertThat(end).isEqualTo(RunLoop.State.COMPLETE);
        assertThat(sleeps).containsExactly(Duration.ofMillis(3000), Duration.ofMillis(3000));
    }

    @Test
    void nonTransientFailure_endsTheLoop() {
        client.then(new TickClientException("HTTP 404: Job not found", false));

        RunLoop.State end = loop.run();

        assertThat(end).isEqualTo(RunLoop.State.FAILED);
        assertThat(loop.lastError()).contains("404");
    }

    @Test
    void authoritativeStatus_mapsToLoopState() {
        client.then(tick(true, "FAILED", 1));
        assertThat(loop.run()).isEqualTo(RunLoop.State.FAILED);

        client.then(tick(true, "PAUSED", 0));
        assertThat(loop.run()).isEqualTo(RunLoop.State.PAUSED);

        client.then(tick(true, "STOPPED", 0));
        assertThat(loop.run()).isEqualTo(RunLoop.State.IDLE);
    }

    @Test
    void pause_persistsBeforeSettingTheAbortFlag() {
        AtomicReference<RunLoop> pausing = new AtomicReference<>();
        List<RunLoop.State> stateWhilePersisting = new ArrayList<>();
        client.pauseHook = () -> stateWhilePersisting.add(pausing.get().state());
        client.then(tick(false, "RUNNING", 1));
        // The user pauses while the loop sleeps between ticks.
        pausing.set(new RunLoop(JOB_ID, client, settings, d -> pausing.get().pause()));

        RunLoop.State end = pausing.get().run();

        assertThat(end).isEqualTo(RunLoop.State.PAUSED);
        assertThat(stateWhilePersisting).containsExactly(RunLoop.State.RUNNING);
        assertThat(client.calls).containsExactly("tick", "pause");
    }

    @Test
    void failedPause_leavesLoopStateUntouched() {
        client.pauseFailure = new TickClientException("HTTP 503", true);

        assertThatThrownBy(loop::pause).isInstanceOf(TickClientException.class);
        assertThat(loop.state()).isEqualTo(RunLoop.State.IDLE);
    }

    @Test
    void resume_persistsRunningThenTicks() {
        client.then(tick(true, "COMPLETED", 1));

        RunLoop.State end = loop.resume();

        assertThat(end).isEqualTo(RunLoop.State.COMPLETE);
        assertThat(client.calls).containsExactly("resume", "tick");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static TickResponse tick(boolean done, String status, int processed) {
        return new TickResponse(done, false, job(status), processed);
    }

    private static JobResponse job(String status) {
        return new JobResponse(JOB_ID, "DOCUMENT_AUTORUN", "proj-1", "film", status,
                5, 0, 0, 0, false, null, null, null, null,
                new JobResponse.PolicyResponse(false, false, 1, "REGENERATE"),
                "tick", null, null, null, null);
    }

    /** Replays scripted tick answers in order and records every call. */
    private static class ScriptedClient implements TickClient {

        final Deque<Object>       script = new ArrayDeque<>();
        final List<String>        calls  = new ArrayList<>();
        Runnable                  pauseHook = () -> {};
        TickClientException       pauseFailure;

        ScriptedClient then(Object answer) {
            script.add(answer);
            return this;
        }

        @Override
        public TickResponse tick(UUID jobId, Integer maxItemsPerTick) {
            calls.add("tick");
            Object next = script.poll();
            if (next instanceof TickClientException e) {
                throw e;
            }
            if (next == null) {
                throw new TickClientException("script exhausted", false);
            }
            return (TickResponse) next;
        }

        @Override
        public JobResponse pause(UUID jobId) {
            calls.add("pause");
            if (pauseFailure != null) {
                throw pauseFailure;
            }
            pauseHook.run();
            return job("PAUSED");
        }

        @Override
        public JobResponse resume(UUID jobId) {
            calls.add("resume");
            return job("RUNNING");
        }

        @Override
        public JobResponse stop(UUID jobId) {
            calls.add("stop");
            return job("STOPPED");
        }
    }
}
