package com.reelpipe.orchestrator.service;

import com.reelpipe.orchestrator.MutableClock;
import com.reelpipe.orchestrator.claim.ClaimProtocol;
import com.reelpipe.orchestrator.config.PipelineProperties;
import com.reelpipe.orchestrator.model.Chunk;
import com.reelpipe.orchestrator.model.ChunkStatus;
import com.reelpipe.orchestrator.repository.ChunkRepository;
import com.reelpipe.orchestrator.repository.ItemRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ChunkTracker against the real repositories on an in-memory database.
 */
@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class ChunkTrackerTest {

    private static final String DOC = "proj-1:episode_beats";
    private static final String VER = "r1";

    @Autowired ChunkRepository chunkRepo;
    @Autowired ItemRepository  itemRepo;

    MutableClock clock;
    ChunkTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        ClaimProtocol claims = new ClaimProtocol(itemRepo, chunkRepo, clock,
                new SimpleMeterRegistry(), PipelineProperties.defaults());
        tracker = new ChunkTracker(chunkRepo, claims, clock);
    }

    // ------------------------------------------------------------------
    // Partial regeneration
    // ------------------------------------------------------------------

    @Test
    void regenerateMissing_enqueuesOnlyMissingChunks() {
        group(ChunkStatus.DONE, ChunkStatus.FAILED, ChunkStatus.DONE, ChunkStatus.NEEDS_REGEN);

        List<Integer> enqueued = tracker.regenerateMissing(DOC, VER);

        assertThat(enqueued).containsExactly(1, 3);
        assertThat(tracker.chunkStatus(DOC, VER).chunks())
                .extracting(ChunkGroup.ChunkView::status)
                .containsExactly(ChunkStatus.DONE, ChunkStatus.QUEUED, ChunkStatus.DONE, ChunkStatus.QUEUED);
    }

    @Test
    void regenerate_withoutResume_enqueuesEveryChunk() {
        group(ChunkStatus.DONE, ChunkStatus.FAILED_VALIDATION);

        assertThat(tracker.regenerate(DOC, VER, false)).containsExactly(0, 1);
    }

    @Test
    void regenerate_unknownGroup_isNotFound() {
        assertThatThrownBy(() -> tracker.regenerateMissing("nope", VER))
                .isInstanceOf(ChunkGroupNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Group creation and claims
    // ------------------------------------------------------------------

    @Test
    void ensureGroup_createsOnce() {
        List<ChunkPlanner.ChunkSpec> specs = List.of(
                new ChunkPlanner.ChunkSpec(0, "episodes-01-08", 1, 8),
                new ChunkPlanner.ChunkSpec(1, "episodes-09-12", 9, 12));

        tracker.ensureGroup(DOC, VER, specs);
        ChunkGroup group = tracker.ensureGroup(DOC, VER, specs);

        assertThat(group.chunks()).hasSize(2);
        assertThat(chunkRepo.countByDocumentIdAndVersionId(DOC, VER)).isEqualTo(2);
        assertThat(group.isComplete()).isFalse();
    }

    @Test
    void claimNext_handsOutEachChunkOnce() {
        group(ChunkStatus.QUEUED, ChunkStatus.QUEUED);

        Optional<Chunk> a = tracker.claimNext(DOC, VER, "tick-a");
        Optional<Chunk> b = tracker.claimNext(DOC, VER, "tick-b");
        Optional<Chunk> c = tracker.claimNext(DOC, VER, "tick-c");

        assertThat(a).map(Chunk::getChunkIndex).contains(0);
        assertThat(b).map(Chunk::getChunkIndex).contains(1);
        assertThat(c).isEmpty();
    }

    @Test
    void recordDone_isFencedByOwner() {
        group(ChunkStatus.QUEUED);
        Chunk chunk = tracker.claimNext(DOC, VER, "tick-a").orElseThrow();

        assertThat(tracker.recordDone(chunk, "tick-b", "artifact://x", 10)).isFalse();
        assertThat(tracker.recordDone(chunk, "tick-a", "artifact://x", 10)).isTrue();

        ChunkGroup group = tracker.chunkStatus(DOC, VER);
        assertThat(group.isComplete()).isTrue();
        assertThat(group.chunks().get(0).charCount()).isEqualTo(10);
    }

    @Test
    void expiredLease_isReclaimed_untilAttemptsRunOut() {
        group(ChunkStatus.QUEUED);
        Duration pastTtl = Duration.ofSeconds(91);

        assertThat(tracker.claimNext(DOC, VER, "tick-1")).isPresent();
        clock.advance(pastTtl);
        assertThat(tracker.claimNext(DOC, VER, "tick-2")).isPresent();
        clock.advance(pastTtl);
        assertThat(tracker.claimNext(DOC, VER, "tick-3")).isPresent();
        clock.advance(pastTtl);

        assertThat(tracker.claimNext(DOC, VER, "tick-4")).isEmpty();
        ChunkGroup.ChunkView chunk = tracker.chunkStatus(DOC, VER).chunks().get(0);
        assertThat(chunk.status()).isEqualTo(ChunkStatus.FAILED);
        assertThat(chunk.error()).isEqualTo("lease expired after 3 attempts");
    }

    @Test
    void explicitFailure_staysFailedUntilRegenerated() {
        group(ChunkStatus.QUEUED);
        Chunk chunk = tracker.claimNext(DOC, VER, "tick-a").orElseThrow();
        tracker.recordFailure(chunk, "tick-a", ChunkStatus.FAILED_VALIDATION, "missing episodes [3]");

        assertThat(tracker.claimNext(DOC, VER, "tick-b")).isEmpty();

        tracker.regenerateMissing(DOC, VER);
        assertThat(tracker.claimNext(DOC, VER, "tick-c")).isPresent();
    }

    private void group(ChunkStatus... statuses) {
        for (int i = 0; i < statuses.length; i++) {
            Chunk chunk = new Chunk(DOC, VER, i, String.format("part-%02d", i + 1));
            chunk.setStatus(statuses[i]);
            chunkRepo.save(chunk);
        }
        chunkRepo.flush();
    }
}
