package com.cronq;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/**
 * Executes the task payload of a cron job. A payload looks like
 * {@code {"$crud": {...}}}; the handler whose {@link #getOperator()} matches the
 * single top-level key receives the value under that key.
 * Note: The class must be registered as a Spring Bean to be detected.
 */
public interface CronTaskHandler {

    /**
     * The payload key this handler is responsible for, e.g. {@code $crud} or
     * {@code $api}. Must be unique across handlers.
     */
    String getOperator();

    /**
     * Executes one occurrence of a job.
     * Any exception thrown from this method is reported as a failed execution
     * and handed to the job's retry policy.
     *
     * @param jobId   the job being executed
     * @param operand the value stored under the operator key
     * @return a short message recorded in the job's log
     * @throws Exception if execution fails
     */
    String execute(UUID jobId, JsonNode operand) throws Exception;
}
