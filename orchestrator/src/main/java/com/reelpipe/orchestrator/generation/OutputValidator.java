package com.reelpipe.orchestrator.generation;

import com.reelpipe.orchestrator.generation.dto.GenerationRequest;
import com.reelpipe.orchestrator.generation.dto.GenerationResult;

import java.util.List;

/**
 * Correctness check on a produced artifact.
 *
 * A non-empty result turns an otherwise successful call into
 * FAILED_VALIDATION. All beans of this type are applied by the step executor.
 */
public interface OutputValidator {

    /** @return human-readable problems; empty when the output passes */
    List<String> validate(GenerationRequest request, GenerationResult result);
}
