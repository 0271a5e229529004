package com.reelpipe.orchestrator.generation;

import com.reelpipe.orchestrator.generation.dto.GenerationRequest;
import com.reelpipe.orchestrator.generation.dto.GenerationResult;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rejects outputs that summarize instead of writing everything out
 * ("remaining episodes follow a similar pattern", "for brevity", ...).
 */
@Component
@Order(10)
public class BannedPhraseValidator implements OutputValidator {

    static final List<String> BANNED_PHRASES = List.of(
            "remaining episodes follow a similar",
            "remaining episodes",
            "and so on",
            "episodes follow the same",
            "continue in a similar",
            "highlights only",
            "selected highlights",
            "summary of episodes",
            "episodes can be summarized",
            "for brevity",
            "condensed version",
            "abbreviated version",
            "rest of the episodes",
            "episodes follow this pattern",
            "similar structure continues",
            "this pattern repeats",
            "etc.",
            "…and more"
    );

    static final List<Pattern> BANNED_PATTERNS = List.of(
            Pattern.compile("episodes?\\s+\\d+[\\s–\\-—]+\\d+\\s*(follow|continue|are similar|share|mirror)",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("eps?\\s+\\d+[\\s–\\-—]+\\d+:\\s*(same|similar|as above|see above)",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\(episodes?\\s+\\d+[\\s–\\-—]+\\d+\\s+(omitted|skipped|summarized)\\)",
                    Pattern.CASE_INSENSITIVE)
    );

    @Override
    public List<String> validate(GenerationRequest request, GenerationResult result) {
        String text = result.excerpt();
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> hits = new ArrayList<>();
        String lower = text.toLowerCase(Locale.ROOT);
        for (String phrase : BANNED_PHRASES) {
            if (lower.contains(phrase)) {
                hits.add("summarization phrase: \"" + phrase + "\"");
            }
        }
        for (Pattern pattern : BANNED_PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                hits.add("summarization pattern: \"" + m.group() + "\"");
            }
        }
        return hits;
    }
}
