package com.cronq.internal;

import com.cronq.CronTaskHandler;
import com.cronq.ExecutionResult;
import com.cronq.config.CronQProperties;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.ClassUtils;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Routes a job's task payload to the {@link CronTaskHandler} registered for its
 * operator key and runs it on a bounded worker pool, so callers get control
 * back immediately.
 */
public class CronTaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CronTaskDispatcher.class);
    static final String DEFAULT_SUCCESS_MESSAGE = "Task executed successfully";

    private final Map<String, CronTaskHandler> handlers;
    private final ThreadPoolExecutor processingExecutor;

    public CronTaskDispatcher(List<CronTaskHandler> handlers, CronQProperties properties) {
        Map<String, CronTaskHandler> registrations = new LinkedHashMap<>();
        for (CronTaskHandler handler : handlers) {
            String operator = handler.getOperator() == null ? "" : handler.getOperator().trim();
            if (operator.isEmpty()) {
                throw new IllegalStateException("CronTaskHandler " + ClassUtils.getUserClass(handler).getName()
                        + " must declare a non-blank operator");
            }
            CronTaskHandler existing = registrations.putIfAbsent(operator, handler);
            if (existing != null) {
                throw new IllegalStateException("Duplicate operator '" + operator + "' detected while registering "
                        + ClassUtils.getUserClass(handler).getName() + ". Each operator must be unique.");
            }
        }
        this.handlers = Map.copyOf(registrations);

        int workerCount = Math.max(1, properties.getExecution().getWorkerCount());
        this.processingExecutor = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(Math.max(32, workerCount * 8)),
                new ThreadPoolExecutor.AbortPolicy());
        log.info("Cron task dispatcher initialized with {} worker(s) and operators {}", workerCount,
                this.handlers.keySet());
    }

    public Set<String> operators() {
        return handlers.keySet();
    }

    /**
     * Executes the task asynchronously. The returned future never completes
     * exceptionally; failures are reported as {@link ExecutionResult#failure(String)}.
     */
    public CompletableFuture<ExecutionResult> dispatch(UUID jobId, JsonNode task) {
        if (task == null || !task.isObject() || task.size() != 1) {
            return CompletableFuture.completedFuture(
                    ExecutionResult.failure("Task must be an object with exactly one operator key"));
        }
        Iterator<Map.Entry<String, JsonNode>> fields = task.fields();
        Map.Entry<String, JsonNode> operation = fields.next();
        CronTaskHandler handler = handlers.get(operation.getKey());
        if (handler == null) {
            return CompletableFuture.completedFuture(
                    ExecutionResult.failure("No handler registered for operator '" + operation.getKey() + "'"));
        }

        try {
            return CompletableFuture.supplyAsync(() -> execute(jobId, handler, operation.getValue()),
                    processingExecutor);
        } catch (RejectedExecutionException saturated) {
            log.warn("Rejected execution of job {} because the worker queue is saturated", jobId);
            return CompletableFuture.completedFuture(ExecutionResult.failure("Worker queue saturated"));
        }
    }

    private ExecutionResult execute(UUID jobId, CronTaskHandler handler, JsonNode operand) {
        try {
            String message = handler.execute(jobId, operand);
            return ExecutionResult.success(message == null || message.isBlank() ? DEFAULT_SUCCESS_MESSAGE : message);
        } catch (Exception e) {
            log.error("Task of job {} failed in handler {}", jobId, handler.getOperator(), e);
            String message = e.getMessage() == null ? e.getClass().getName() : e.getMessage();
            return ExecutionResult.failure(message);
        }
    }

    @PreDestroy
    void shutdownExecutor() {
        processingExecutor.shutdown();
    }
}
