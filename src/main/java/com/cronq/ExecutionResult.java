package com.cronq;

/**
 * Outcome reported by the task execution collaborator.
 */
public record ExecutionResult(Status status, String message) {

    public enum Status {
        SUCCESS,
        FAILURE
    }

    public static ExecutionResult success(String message) {
        return new ExecutionResult(Status.SUCCESS, message);
    }

    public static ExecutionResult failure(String message) {
        return new ExecutionResult(Status.FAILURE, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
