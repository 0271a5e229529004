package com.reelpipe.orchestrator.driver;

import com.reelpipe.orchestrator.config.PipelineProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs run loops inside the orchestrator on a fixed worker pool.
 *
 * Enabled with {@code reelpipe.driver.embedded=true}. The controllers call
 * {@link #launch} after start, resume, retry, regen and approve. One loop
 * per job; launching a job whose loop is still running is a no-op.
 * Pause and stop go through the job service; the loop sees the persisted
 * status on its next tick and ends.
 */
@Component
@ConditionalOnProperty(prefix = "reelpipe.driver", name = "embedded", havingValue = "true")
public class EmbeddedDriver {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedDriver.class);

    private final TickClient                client;
    private final PipelineProperties.Driver settings;
    private final ExecutorService           workers;
    private final Map<UUID, RunLoop>        loops = new ConcurrentHashMap<>();

    public EmbeddedDriver(LocalTickClient client, PipelineProperties props) {
        this.client   = client;
        this.settings = props.driver();
        this.workers  = Executors.newFixedThreadPool(settings.workers());
    }

    public void launch(UUID jobId) {
        RunLoop loop = loops.computeIfAbsent(jobId, id -> new RunLoop(id, client, settings, Sleeper.THREAD));
        if (loop.isRunning()) {
            log.debug("Run loop for job {} already running", jobId);
            return;
        }
        workers.submit(() -> {
            RunLoop.State end = loop.run();
            log.info("Embedded run loop for job {} ended in state {}", jobId, end);
            if (end != RunLoop.State.RUNNING) {
                loops.remove(jobId, loop);
            }
        });
    }

    public Optional<RunLoop> loop(UUID jobId) {
        return Optional.ofNullable(loops.get(jobId));
    }

    @PreDestroy
    public void shutdown() {
        loops.values().forEach(RunLoop::abort);
        workers.shutdownNow();
    }
}
