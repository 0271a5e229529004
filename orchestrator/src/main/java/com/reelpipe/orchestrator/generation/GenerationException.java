package com.reelpipe.orchestrator.generation;

/**
 * Thrown when the generation service returns an error or is unreachable.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
