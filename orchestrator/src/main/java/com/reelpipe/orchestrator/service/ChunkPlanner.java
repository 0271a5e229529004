package com.reelpipe.orchestrator.service;

import com.reelpipe.orchestrator.config.PipelineProperties;
import com.reelpipe.orchestrator.model.Item;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether an item is too large for one generation call and, if so,
 * how it splits.
 *
 * Episodic stages split into fixed episode batches ("episodes-01-08"); any
 * other item estimated above the per-call character budget splits into
 * equal parts ("part-01"). Plans are deterministic for a given item, so
 * every caller computes the same chunk keys.
 */
@Component
public class ChunkPlanner {

    public record ChunkSpec(int index, String key, int episodeFrom, int episodeTo) {}

    private static final Pattern EPISODE_KEY = Pattern.compile("episodes-(\\d+)-(\\d+)");

    private final int         maxCharsPerCall;
    private final int         episodesPerChunk;
    private final Set<String> episodicStages;

    public ChunkPlanner(PipelineProperties props) {
        this.maxCharsPerCall  = props.chunking().maxCharsPerCall();
        this.episodesPerChunk = props.chunking().episodesPerChunk();
        this.episodicStages   = Set.copyOf(props.chunking().episodicStages());
    }

    /** Empty when the item fits in a single call. */
    public List<ChunkSpec> plan(Item item) {
        if (item.targetsSingleChunk()) {
            return List.of();
        }
        List<ChunkSpec> chunks = new ArrayList<>();
        if (episodicStages.contains(item.getStageKey()) && item.getEpisodeSpan() > episodesPerChunk) {
            for (int from = 1, idx = 0; from <= item.getEpisodeSpan(); from += episodesPerChunk, idx++) {
                int to = Math.min(from + episodesPerChunk - 1, item.getEpisodeSpan());
                chunks.add(new ChunkSpec(idx, String.format("episodes-%02d-%02d", from, to), from, to));
            }
        } else if (item.getEstimatedChars() > maxCharsPerCall) {
            int parts = (item.getEstimatedChars() + maxCharsPerCall - 1) / maxCharsPerCall;
            for (int i = 0; i < parts; i++) {
                chunks.add(new ChunkSpec(i, String.format("part-%02d", i + 1), 0, 0));
            }
        }
        return chunks;
    }

    /** Episode range encoded in a chunk key, or {0, 0} for part chunks. */
    public static int[] episodeRange(String chunkKey) {
        Matcher m = EPISODE_KEY.matcher(chunkKey);
        if (m.matches()) {
            return new int[] { Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)) };
        }
        return new int[] { 0, 0 };
    }
}
