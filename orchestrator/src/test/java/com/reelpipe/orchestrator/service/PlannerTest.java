package com.reelpipe.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reelpipe.orchestrator.config.PipelineProperties;
import com.reelpipe.orchestrator.ladder.StageLadderRegistry;
import com.reelpipe.orchestrator.model.Item;
import com.reelpipe.orchestrator.model.JobKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for JobPlanner (which items a job gets) and ChunkPlanner
 * (how an oversized item splits).
 */
class PlannerTest {

    private final StageLadderRegistry ladders = new StageLadderRegistry(new ObjectMapper());
    private final PipelineProperties  props   = PipelineProperties.defaults();
    private final JobPlanner          planner = new JobPlanner(ladders, props);
    private final ChunkPlanner        chunks  = new ChunkPlanner(props);

    // ------------------------------------------------------------------
    // JobPlanner
    // ------------------------------------------------------------------

    @Test
    void documentAutorun_plansTheLadderSliceWithGates() {
        PlanOptions options = new PlanOptions("concept_brief", "documentary_outline",
                List.of("Market Sheet"), 0, null, Map.of("documentary_outline", 20_000));

        List<JobPlanner.PlannedItem> items = planner.plan(JobKind.DOCUMENT_AUTORUN, "documentary", options);

        assertThat(items).extracting(JobPlanner.PlannedItem::stageKey)
                .containsExactly("concept_brief", "market_sheet", "documentary_outline");
        assertThat(items).extracting(JobPlanner.PlannedItem::requiresApproval)
                .containsExactly(false, true, false);
        assertThat(items.get(2).estimatedChars()).isEqualTo(20_000);
    }

    @Test
    void episodicLadderStage_carriesEpisodeSpan() {
        PlanOptions options = new PlanOptions("episode_beats", "episode_beats", null, 20, null, null);

        List<JobPlanner.PlannedItem> items = planner.plan(JobKind.DOCUMENT_AUTORUN, "tv-series", options);

        assertThat(items).singleElement().satisfies(i -> assertThat(i.episodeSpan()).isEqualTo(20));
    }

    @Test
    void episodeScripts_oneItemPerEpisode() {
        PlanOptions options = new PlanOptions(null, null, null, 3, null, null);

        List<JobPlanner.PlannedItem> items = planner.plan(JobKind.EPISODE_SCRIPTS, "tv-series", options);

        assertThat(items).extracting(JobPlanner.PlannedItem::unitKey)
                .containsExactly("episode-01", "episode-02", "episode-03");
    }

    @Test
    void trailerRender_defaultsToFinalCut() {
        List<JobPlanner.PlannedItem> items = planner.plan(JobKind.TRAILER_RENDER, "film", PlanOptions.none());

        assertThat(items).extracting(JobPlanner.PlannedItem::unitKey).containsExactly("final");
    }

    @Test
    void emptyPlanAndChunkRegen_areRejected() {
        assertThatThrownBy(() -> planner.plan(JobKind.TRAILER_CLIPS, "film", PlanOptions.none()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> planner.plan(JobKind.CHUNK_REGEN, "film", PlanOptions.none()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // ChunkPlanner
    // ------------------------------------------------------------------

    @Test
    void smallItem_isNotChunked() {
        Item item = item("treatment");
        item.setEstimatedChars(8_000);

        assertThat(chunks.plan(item)).isEmpty();
    }

    @Test
    void episodicStage_splitsIntoEpisodeBatches() {
        Item item = item("episode_beats");
        item.setEpisodeSpan(20);

        assertThat(chunks.plan(item)).extracting(ChunkPlanner.ChunkSpec::key)
                .containsExactly("episodes-01-08", "episodes-09-16", "episodes-17-20");
    }

    @Test
    void largeItem_splitsIntoParts() {
        Item item = item("feature_script");
        item.setEstimatedChars(30_000);

        assertThat(chunks.plan(item)).extracting(ChunkPlanner.ChunkSpec::key)
                .containsExactly("part-01", "part-02", "part-03");
    }

    @Test
    void targetedChunkItem_isNeverReplanned() {
        Item item = item("chunk");
        item.setEstimatedChars(50_000);
        item.targetChunk("proj-1:feature_script", "r1", 2);

        assertThat(chunks.plan(item)).isEmpty();
    }

    @Test
    void episodeRange_readsEpisodeKeys() {
        assertThat(ChunkPlanner.episodeRange("episodes-09-16")).containsExactly(9, 16);
        assertThat(ChunkPlanner.episodeRange("part-02")).containsExactly(0, 0);
    }

    private static Item item(String stage) {
        return new Item(UUID.randomUUID(), 0, stage, stage);
    }
}
