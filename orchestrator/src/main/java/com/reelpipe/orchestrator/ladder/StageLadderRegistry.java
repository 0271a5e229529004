package com.reelpipe.orchestrator.ladder;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Format → ordered stage keys.
 *
 * Ladders are data ({@code stage-ladders.json} on the classpath), so a new
 * format is a JSON edit, not a code change. Lookups are pure: the table is
 * loaded once and never mutated.
 *
 * Unknown formats resolve to the default ladder rather than an empty one.
 */
@Component
public class StageLadderRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageLadderRegistry.class);

    static final String RESOURCE = "stage-ladders.json";

    // Keys that older data uses but that must never appear in a ladder.
    private static final Set<String> LEGACY_KEYS = Set.of("draft", "coverage", "blueprint");

    /** Shape of stage-ladders.json. */
    public record LadderTable(String defaultFormat,
                              Map<String, List<String>> formats,
                              Map<String, String> formatAliases,
                              Map<String, String> stageAliases) {}

    private final String defaultFormat;
    private final Map<String, List<String>> ladders;
    private final Map<String, String> formatAliases;
    private final Map<String, String> stageAliases;

    @Autowired
    public StageLadderRegistry(ObjectMapper objectMapper) {
        this(load(objectMapper));
    }

    public StageLadderRegistry(LadderTable table) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        table.formats().forEach((format, stages) -> copy.put(format, List.copyOf(stages)));
        this.ladders       = Map.copyOf(copy);
        this.defaultFormat = table.defaultFormat();
        this.formatAliases = table.formatAliases() == null ? Map.of() : Map.copyOf(table.formatAliases());
        this.stageAliases  = table.stageAliases() == null ? Map.of() : Map.copyOf(table.stageAliases());

        List<String> problems = selfTest();
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid stage ladder table: " + problems);
        }
        log.info("Loaded {} stage ladders (default format '{}')", ladders.size(), defaultFormat);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /** Ordered stages for a format. Never empty. */
    public List<String> ladderFor(String format) {
        return ladders.getOrDefault(normalizeFormat(format), ladders.get(defaultFormat));
    }

    /** The stage after {@code current} in the format's ladder, or empty at the end / if unknown. */
    public Optional<String> nextStage(String current, String format) {
        List<String> ladder = ladderFor(format);
        int idx = ladder.indexOf(normalizeStage(current));
        return (idx >= 0 && idx < ladder.size() - 1) ? Optional.of(ladder.get(idx + 1)) : Optional.empty();
    }

    /**
     * Stages from {@code startStage} to {@code targetStage}, both inclusive.
     * A null bound means the start or end of the ladder.
     *
     * @throws IllegalArgumentException if a bound is not in the ladder or start comes after target
     */
    public List<String> slice(String format, String startStage, String targetStage) {
        List<String> ladder = ladderFor(format);
        int from = startStage == null ? 0 : requireIndex(ladder, startStage, format);
        int to   = targetStage == null ? ladder.size() - 1 : requireIndex(ladder, targetStage, format);
        if (from > to) {
            throw new IllegalArgumentException(
                    "Start stage '" + startStage + "' comes after target stage '" + targetStage + "'");
        }
        return ladder.subList(from, to + 1);
    }

    public boolean isKnownFormat(String format) {
        return ladders.containsKey(normalizeFormat(format));
    }

    public String defaultFormat() {
        return defaultFormat;
    }

    public Set<String> formats() {
        return ladders.keySet();
    }

    // ------------------------------------------------------------------
    // Normalization
    // ------------------------------------------------------------------

    /** "Vertical_Drama" → "vertical-drama"; aliases ("series") resolve to canonical formats. */
    public String normalizeFormat(String raw) {
        if (raw == null || raw.isBlank()) {
            return defaultFormat;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[_\\s]+", "-");
        return formatAliases.getOrDefault(key, key);
    }

    /** "Story Outline" → "story_outline"; legacy labels ("blueprint") resolve to canonical keys. */
    public String normalizeStage(String raw) {
        if (raw == null) {
            return null;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        return stageAliases.getOrDefault(key, key);
    }

    // ------------------------------------------------------------------
    // Self-test
    // ------------------------------------------------------------------

    /**
     * Structural checks on the loaded table. Empty list = healthy.
     *
     * Checks, per format: non-empty, starts with "idea", no duplicates,
     * no legacy keys, and nextStage agrees with list order.
     */
    public List<String> selfTest() {
        List<String> problems = new ArrayList<>();
        if (defaultFormat == null || !ladders.containsKey(defaultFormat)) {
            problems.add("default format '" + defaultFormat + "' has no ladder");
        }
        ladders.forEach((format, ladder) -> {
            if (ladder.isEmpty()) {
                problems.add(format + ": empty ladder");
                return;
            }
            if (!"idea".equals(ladder.get(0))) {
                problems.add(format + ": ladder must start with 'idea', starts with '" + ladder.get(0) + "'");
            }
            Set<String> seen = new HashSet<>();
            for (String stage : ladder) {
                if (!seen.add(stage)) {
                    problems.add(format + ": duplicate stage '" + stage + "'");
                }
                if (LEGACY_KEYS.contains(stage)) {
                    problems.add(format + ": legacy stage key '" + stage + "'");
                }
            }
            for (int i = 0; i < ladder.size(); i++) {
                Optional<String> expected = i < ladder.size() - 1 ? Optional.of(ladder.get(i + 1)) : Optional.empty();
                Optional<String> actual = nextStageRaw(ladder, ladder.get(i));
                if (!expected.equals(actual)) {
                    problems.add(format + ": nextStage(" + ladder.get(i) + ") = " + actual + ", expected " + expected);
                }
            }
        });
        return problems;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    // Without alias resolution, so aliases cannot mask a broken ladder.
    private static Optional<String> nextStageRaw(List<String> ladder, String stage) {
        int idx = ladder.indexOf(stage);
        return (idx >= 0 && idx < ladder.size() - 1) ? Optional.of(ladder.get(idx + 1)) : Optional.empty();
    }

    private int requireIndex(List<String> ladder, String stage, String format) {
        int idx = ladder.indexOf(normalizeStage(stage));
        if (idx < 0) {
            throw new IllegalArgumentException(
                    "Stage '" + stage + "' is not part of the " + normalizeFormat(format) + " ladder");
        }
        return idx;
    }

    private static LadderTable load(ObjectMapper objectMapper) {
        try (InputStream in = new ClassPathResource(RESOURCE).getInputStream()) {
            return objectMapper.readValue(in, LadderTable.class);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + RESOURCE + " from the classpath", e);
        }
    }
}
