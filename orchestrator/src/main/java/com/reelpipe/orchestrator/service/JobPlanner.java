package com.reelpipe.orchestrator.service;

import com.reelpipe.orchestrator.config.PipelineProperties;
import com.reelpipe.orchestrator.ladder.StageLadderRegistry;
import com.reelpipe.orchestrator.model.JobKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a start request into the ordered list of items to create.
 */
@Component
public class JobPlanner {

    /** One item to create; list position is the item index. */
    public record PlannedItem(String stageKey,
                              String unitKey,
                              boolean requiresApproval,
                              int estimatedChars,
                              int episodeSpan) {}

    private final StageLadderRegistry ladders;
    private final Set<String>         episodicStages;

    public JobPlanner(StageLadderRegistry ladders, PipelineProperties props) {
        this.ladders        = ladders;
        this.episodicStages = Set.copyOf(props.chunking().episodicStages());
    }

    /**
     * @throws IllegalArgumentException if the options do not describe at least one item
     */
    public List<PlannedItem> plan(JobKind kind, String format, PlanOptions options) {
        List<PlannedItem> items = switch (kind) {
            case DOCUMENT_AUTORUN -> planLadder(format, options);
            case EPISODE_SCRIPTS  -> planEpisodes(options);
            case TRAILER_CLIPS    -> planUnits("clip", options, List.of());
            case TRAILER_AUDIO    -> planUnits("audio", options, List.of());
            case TRAILER_RENDER   -> planUnits("render", options, List.of("final"));
            case CHUNK_REGEN      -> throw new IllegalArgumentException(
                    "CHUNK_REGEN jobs are created through chunk regeneration, not started directly");
        };
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Nothing to do for a " + kind + " job with these options");
        }
        return items;
    }

    // ------------------------------------------------------------------
    // Per-kind planning
    // ------------------------------------------------------------------

    private List<PlannedItem> planLadder(String format, PlanOptions options) {
        Set<String> gates = options.approvalStages().stream()
                .map(ladders::normalizeStage)
                .collect(Collectors.toSet());
        List<PlannedItem> items = new ArrayList<>();
        for (String stage : ladders.slice(format, options.startStage(), options.targetStage())) {
            int span = episodicStages.contains(stage) ? options.episodeCount() : 0;
            items.add(new PlannedItem(stage, stage, gates.contains(stage),
                    options.stageCharEstimates().getOrDefault(stage, 0), span));
        }
        return items;
    }

    private List<PlannedItem> planEpisodes(PlanOptions options) {
        List<PlannedItem> items = new ArrayList<>();
        for (int ep = 1; ep <= options.episodeCount(); ep++) {
            items.add(new PlannedItem("episode_script", String.format("episode-%02d", ep), false,
                    options.stageCharEstimates().getOrDefault("episode_script", 0), 1));
        }
        return items;
    }

    private List<PlannedItem> planUnits(String stageKey, PlanOptions options, List<String> fallback) {
        List<String> keys = options.unitKeys().isEmpty() ? fallback : options.unitKeys();
        Set<String> gates = Set.copyOf(options.approvalStages());
        return keys.stream()
                .map(key -> new PlannedItem(stageKey, key, gates.contains(key), 0, 0))
                .toList();
    }
}
