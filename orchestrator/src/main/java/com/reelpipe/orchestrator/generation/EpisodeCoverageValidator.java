package com.reelpipe.orchestrator.generation;

import com.reelpipe.orchestrator.generation.dto.GenerationRequest;
import com.reelpipe.orchestrator.generation.dto.GenerationResult;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

/**
 * For episode-range units: every episode in the requested range must have
 * a heading in the output ("## EPISODE 3", "**EP 3", "EPISODE 3:").
 */
@Component
@Order(20)
public class EpisodeCoverageValidator implements OutputValidator {

    private static final List<Pattern> HEADINGS = List.of(
            Pattern.compile("(?:^|\\n)\\s*#{1,4}\\s*(?:EPISODE|EP\\.?)\\s*(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\*\\*\\s*(?:EPISODE|EP\\.?)\\s*(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:^|\\n)\\s*(?:EPISODE|EP\\.?)\\s*(\\d+)\\s*[:\\-–—]", Pattern.CASE_INSENSITIVE)
    );

    @Override
    public List<String> validate(GenerationRequest request, GenerationResult result) {
        // Only meaningful when the provider returned the full text.
        if (!request.coversEpisodes() || result.excerpt() == null
                || result.excerpt().length() < result.charCount()) {
            return List.of();
        }
        Set<Integer> found = episodeNumbers(result.excerpt());
        List<Integer> missing = IntStream.rangeClosed(request.episodeFrom(), request.episodeTo())
                .filter(ep -> !found.contains(ep))
                .boxed()
                .toList();
        return missing.isEmpty() ? List.of() : List.of("missing episodes " + missing);
    }

    static Set<Integer> episodeNumbers(String text) {
        Set<Integer> found = new TreeSet<>();
        for (Pattern p : HEADINGS) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                found.add(Integer.parseInt(m.group(1)));
            }
        }
        return found;
    }
}
