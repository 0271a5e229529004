package com.reelpipe.orchestrator.ladder;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for StageLadderRegistry against the shipped stage-ladders.json,
 * plus a few hand-built tables for the self-test.
 */
class StageLadderRegistryTest {

    private final StageLadderRegistry registry = new StageLadderRegistry(new ObjectMapper());

    @Test
    void shippedTable_passesSelfTest() {
        assertThat(registry.selfTest()).isEmpty();
        assertThat(registry.formats())
                .contains("film", "tv-series", "vertical-drama", "documentary", "animation", "short");
    }

    @Test
    void documentaryLadder_hasFiveStagesInOrder() {
        assertThat(registry.ladderFor("documentary"))
                .containsExactly("idea", "concept_brief", "market_sheet", "documentary_outline", "deck");
    }

    @Test
    void unknownFormat_fallsBackToDefaultLadder() {
        assertThat(registry.isKnownFormat("opera")).isFalse();
        assertThat(registry.ladderFor("opera")).isEqualTo(registry.ladderFor("film"));
        assertThat(registry.ladderFor(null)).isEqualTo(registry.ladderFor("film"));
    }

    @Test
    void normalizeFormat_acceptsCaseSeparatorsAndAliases() {
        assertThat(registry.normalizeFormat("Vertical_Drama")).isEqualTo("vertical-drama");
        assertThat(registry.normalizeFormat("TV Series")).isEqualTo("tv-series");
        assertThat(registry.normalizeFormat("series")).isEqualTo("tv-series");
        assertThat(registry.normalizeFormat("  ")).isEqualTo("film");
    }

    @Test
    void normalizeStage_resolvesLegacyLabels() {
        assertThat(registry.normalizeStage("Story Outline")).isEqualTo("story_outline");
        assertThat(registry.normalizeStage("blueprint")).isEqualTo("treatment");
        assertThat(registry.normalizeStage("draft")).isEqualTo("feature_script");
        assertThat(registry.normalizeStage("coverage")).isEqualTo("production_draft");
    }

    @Test
    void nextStage_followsLadderOrder() {
        assertThat(registry.nextStage("idea", "film")).contains("concept_brief");
        assertThat(registry.nextStage("Beat Sheet", "film")).contains("feature_script");
        assertThat(registry.nextStage("deck", "film")).isEmpty();
        assertThat(registry.nextStage("nonexistent", "film")).isEmpty();
    }

    @Test
    void slice_isInclusiveOnBothEnds() {
        assertThat(registry.slice("film", "treatment", "beat_sheet"))
                .containsExactly("treatment", "story_outline", "character_bible", "beat_sheet");
        assertThat(registry.slice("documentary", null, "market_sheet"))
                .containsExactly("idea", "concept_brief", "market_sheet");
        assertThat(registry.slice("documentary", "documentary_outline", null))
                .containsExactly("documentary_outline", "deck");
    }

    @Test
    void slice_rejectsUnknownStageAndReversedBounds() {
        assertThatThrownBy(() -> registry.slice("documentary", "episode_script", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("episode_script");
        assertThatThrownBy(() -> registry.slice("film", "deck", "idea"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void brokenTable_isRejectedAtConstruction() {
        StageLadderRegistry.LadderTable broken = new StageLadderRegistry.LadderTable(
                "film",
                Map.of("film", List.of("concept_brief", "idea", "draft", "idea")),
                Map.of(),
                Map.of());

        assertThatThrownBy(() -> new StageLadderRegistry(broken))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must start with 'idea'")
                .hasMessageContaining("duplicate stage 'idea'")
                .hasMessageContaining("legacy stage key 'draft'");
    }

    @Test
    void missingDefaultLadder_isRejected() {
        StageLadderRegistry.LadderTable noDefault = new StageLadderRegistry.LadderTable(
                "film", Map.of("short", List.of("idea", "feature_script")), null, null);

        assertThatThrownBy(() -> new StageLadderRegistry(noDefault))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("default format 'film' has no ladder");
    }
}
