package com.reelpipe.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Orchestrator settings bound from the {@code reelpipe.*} namespace.
 *
 * Every group falls back to its defaults when absent from application.yml,
 * so tests can build a complete instance with {@link #defaults()}.
 */
@ConfigurationProperties(prefix = "reelpipe")
public record PipelineProperties(Claim claim, Chunking chunking, Generation generation, Driver driver) {

    public PipelineProperties {
        claim      = claim      == null ? new Claim(null, 0)                      : claim;
        chunking   = chunking   == null ? new Chunking(0, 0, null)                : chunking;
        generation = generation == null ? new Generation(null, null)              : generation;
        driver     = driver     == null ? new Driver(false, 0, null, null, 0, null, 0) : driver;
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(null, null, null, null);
    }

    /**
     * Lease settings shared by items and chunks.
     *
     * @param ttl         how long a claim excludes other callers
     * @param maxAttempts claims allowed without progress before the unit is failed
     */
    public record Claim(Duration ttl, int maxAttempts) {
        public Claim {
            ttl         = ttl == null ? Duration.ofSeconds(90) : ttl;
            maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
        }
    }

    /**
     * @param maxCharsPerCall  items estimated above this are split into parts
     * @param episodesPerChunk episode batch size for episodic stages
     * @param episodicStages   stage keys whose output covers every episode
     */
    public record Chunking(int maxCharsPerCall, int episodesPerChunk, List<String> episodicStages) {
        public Chunking {
            maxCharsPerCall  = maxCharsPerCall <= 0 ? 12_000 : maxCharsPerCall;
            episodesPerChunk = episodesPerChunk <= 0 ? 8 : episodesPerChunk;
            episodicStages   = episodicStages == null
                    ? List.of("episode_beats", "vertical_episode_beats", "episode_script", "season_master_script")
                    : List.copyOf(episodicStages);
        }
    }

    public record Generation(String baseUrl, Duration timeout) {
        public Generation {
            baseUrl = baseUrl == null ? "http://localhost:8000" : baseUrl;
            timeout = timeout == null ? Duration.ofSeconds(120) : timeout;
        }
    }

    /**
     * In-process run loop settings.
     *
     * @param embedded            start run loops inside this process on start/resume/approve
     * @param workers             size of the run-loop thread pool
     * @param initialBackoff      delay after a tick that made progress
     * @param maxBackoff          ceiling for the growing no-progress delay
     * @param backoffFactor       growth per consecutive no-progress tick
     * @param transientRetryDelay fixed delay after a tick call that failed transiently
     * @param maxItemsPerTick     items requested per tick; 0 means "use the job policy"
     */
    public record Driver(boolean embedded,
                         int workers,
                         Duration initialBackoff,
                         Duration maxBackoff,
                         double backoffFactor,
                         Duration transientRetryDelay,
                         int maxItemsPerTick) {
        public Driver {
            workers             = workers <= 0 ? 4 : workers;
            initialBackoff      = initialBackoff == null ? Duration.ofMillis(1000) : initialBackoff;
            maxBackoff          = maxBackoff == null ? Duration.ofMillis(8000) : maxBackoff;
            backoffFactor       = backoffFactor <= 1.0 ? 1.2 : backoffFactor;
            transientRetryDelay = transientRetryDelay == null ? Duration.ofMillis(3000) : transientRetryDelay;
            maxItemsPerTick     = Math.max(0, maxItemsPerTick);
        }
    }
}
