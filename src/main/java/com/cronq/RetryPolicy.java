package com.cronq;

import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * How often a failed execution is retried and how long to wait in between.
 *
 * @param retries       number of retries after the first failed attempt
 * @param retryInterval delay before each retry
 */
public record RetryPolicy(int retries, Duration retryInterval) {

    public RetryPolicy {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0");
        }
        if (retryInterval == null || retryInterval.isNegative()) {
            throw new IllegalArgumentException("retryInterval must be a non-negative duration");
        }
    }

    public static RetryPolicy of(int retries, String retryInterval) {
        if (retryInterval == null || retryInterval.isBlank()) {
            return new RetryPolicy(retries, Duration.ZERO);
        }
        try {
            return new RetryPolicy(retries, Duration.parse(retryInterval.trim()));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unsupported retryInterval: " + retryInterval, e);
        }
    }
}
