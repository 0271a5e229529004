package com.reelpipe.orchestrator.service;

/**
 * Result of one {@link StepExecutor#execute} call.
 *
 * IN_PROGRESS means the item made progress (one chunk done) but needs more
 * invocations; the tick controller releases it back to the queue.
 */
public record ExecutionOutcome(Status status, String outputRef, String error) {

    public enum Status { DONE, FAILED, FAILED_VALIDATION, IN_PROGRESS }

    private static final int MAX_ERROR_LENGTH = 2000;

    public static ExecutionOutcome done(String outputRef) {
        return new ExecutionOutcome(Status.DONE, outputRef, null);
    }

    public static ExecutionOutcome failed(String error) {
        return new ExecutionOutcome(Status.FAILED, null, truncate(error));
    }

    public static ExecutionOutcome failedValidation(String error) {
        return new ExecutionOutcome(Status.FAILED_VALIDATION, null, truncate(error));
    }

    public static ExecutionOutcome inProgress() {
        return new ExecutionOutcome(Status.IN_PROGRESS, null, null);
    }

    public boolean isFailure() {
        return status == Status.FAILED || status == Status.FAILED_VALIDATION;
    }

    private static String truncate(String error) {
        if (error == null) return "unknown error";
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
