package com.reelpipe.orchestrator.generation.dto;

import java.util.List;

/**
 * Response from POST /generate.
 *
 * @param outputRef where the provider stored the artifact
 * @param charCount size of the artifact
 * @param excerpt   leading text of the artifact, used by output validators
 * @param issues    problems the provider itself detected; non-empty means invalid output
 */
public record GenerationResult(
        String       outputRef,
        int          charCount,
        String       excerpt,
        List<String> issues
) {
    public GenerationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
