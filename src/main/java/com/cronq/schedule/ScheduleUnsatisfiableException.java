package com.cronq.schedule;

/**
 * Raised when no instant satisfies a schedule within the search window, or the
 * schedule's cron expression cannot be evaluated. Not retryable.
 */
public class ScheduleUnsatisfiableException extends RuntimeException {

    public ScheduleUnsatisfiableException(String message) {
        super(message);
    }

    public ScheduleUnsatisfiableException(String message, Throwable cause) {
        super(message, cause);
    }
}
