package com.reelpipe.orchestrator.service;

import java.util.List;
import java.util.Map;

/**
 * Kind-specific inputs for materializing a job's items.
 *
 * @param startStage         first ladder stage to run (document autorun); null = ladder start
 * @param targetStage        last ladder stage to run; null = ladder end
 * @param approvalStages     stages that need a human decision before later stages run
 * @param episodeCount       episodes in the season (episode batches and episodic stages)
 * @param unitKeys           clip / audio cue / render keys for trailer jobs
 * @param stageCharEstimates expected artifact size per stage, drives chunk splitting
 */
public record PlanOptions(String startStage,
                          String targetStage,
                          List<String> approvalStages,
                          int episodeCount,
                          List<String> unitKeys,
                          Map<String, Integer> stageCharEstimates) {

    public PlanOptions {
        approvalStages     = approvalStages == null ? List.of() : List.copyOf(approvalStages);
        unitKeys           = unitKeys == null ? List.of() : List.copyOf(unitKeys);
        stageCharEstimates = stageCharEstimates == null ? Map.of() : Map.copyOf(stageCharEstimates);
        episodeCount       = Math.max(0, episodeCount);
    }

    public static PlanOptions none() {
        return new PlanOptions(null, null, null, 0, null, null);
    }
}
