package com.cronq;

import com.cronq.config.CronQProperties;
import com.cronq.schedule.CronExpressionEvaluator;
import com.cronq.schedule.ScheduleSpec;
import com.cronq.schedule.ScheduleSpecMapper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for managing cron jobs. Every change is persisted first and then
 * announced as a {@link RecordChangeEvent}, which is what arms or disarms the
 * job's timer.
 */
@Service
public class CronJobClient {

    private static final Logger log = LoggerFactory.getLogger(CronJobClient.class);

    private final CronJobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final ScheduleSpecMapper scheduleMapper;
    private final CronExpressionEvaluator expressionEvaluator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final String collection;

    public CronJobClient(CronJobRepository jobRepository, @Qualifier("cronqObjectMapper") ObjectMapper objectMapper,
            ScheduleSpecMapper scheduleMapper, CronExpressionEvaluator expressionEvaluator,
            ApplicationEventPublisher eventPublisher, Clock clock, CronQProperties properties) {
        this.jobRepository = jobRepository;
        this.objectMapper = objectMapper;
        this.scheduleMapper = scheduleMapper;
        this.expressionEvaluator = expressionEvaluator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.collection = properties.getEvents().getCollection();
    }

    /**
     * Create an active job without retries.
     */
    public UUID create(String organizationId, ScheduleSpec schedule, Object task) {
        return create(organizationId, schedule, task, null);
    }

    /**
     * Create an active job. {@code task} is serialized as-is and must be an
     * object with a single operator key, e.g. {@code {"$api": {...}}}.
     */
    public UUID create(String organizationId, ScheduleSpec schedule, Object task, RetryPolicy retryPolicy) {
        String normalizedOrganization = normalizeOrganization(organizationId);
        validateSchedule(schedule);

        CronJob job = new CronJob(UUID.randomUUID(), normalizedOrganization, scheduleMapper.write(schedule),
                toTask(task));
        job.setRetryPolicy(retryPolicy);
        job.setUpdatedAt(now());
        CronJob saved = jobRepository.save(job);
        log.debug("Created cron job {} for organization {}", saved.getId(), normalizedOrganization);
        publish(RecordChangeEvent.ChangeType.CREATE, saved);
        return saved.getId();
    }

    /**
     * Replace the schedule of an existing job. The next execution is resolved again.
     */
    public void reschedule(UUID jobId, ScheduleSpec schedule) {
        validateSchedule(schedule);
        CronJob job = require(jobId);
        job.setSchedule(scheduleMapper.write(schedule));
        job.setRetryCount(0);
        job.setOccurrenceTime(null);
        job.setUpdatedAt(now());
        publish(RecordChangeEvent.ChangeType.UPDATE, jobRepository.save(job));
    }

    /**
     * Replace the task payload of an existing job.
     */
    public void updateTask(UUID jobId, Object task) {
        CronJob job = require(jobId);
        job.setTask(toTask(task));
        job.setUpdatedAt(now());
        publish(RecordChangeEvent.ChangeType.UPDATE, jobRepository.save(job));
    }

    /**
     * Re-enable a job. Its status is reset so it is resolved from now on.
     */
    public void activate(UUID jobId) {
        CronJob job = require(jobId);
        if (job.isActive()) {
            return;
        }
        job.setActive(true);
        job.setStatus(CronJobStatus.PENDING);
        job.setRetryCount(0);
        job.setOccurrenceTime(null);
        job.setUpdatedAt(now());
        publish(RecordChangeEvent.ChangeType.UPDATE, jobRepository.save(job));
    }

    /**
     * Disable a job. Its timer is dropped and no further execution happens.
     */
    public void deactivate(UUID jobId) {
        CronJob job = require(jobId);
        if (!job.isActive()) {
            return;
        }
        job.setActive(false);
        job.setUpdatedAt(now());
        publish(RecordChangeEvent.ChangeType.UPDATE, jobRepository.save(job));
    }

    /**
     * Delete a job. Returns false when it did not exist.
     */
    public boolean delete(UUID jobId) {
        Optional<CronJob> job = jobRepository.findById(requireId(jobId));
        if (job.isEmpty()) {
            return false;
        }
        jobRepository.delete(job.get());
        publish(RecordChangeEvent.ChangeType.DELETE, job.get());
        return true;
    }

    public Optional<CronJob> find(UUID jobId) {
        return jobRepository.findById(requireId(jobId));
    }

    /**
     * Earliest upcoming execution among the organization's active jobs.
     */
    public Optional<Instant> nextExecutionForOrganization(String organizationId) {
        return jobRepository
                .findFirstByOrganizationIdAndActiveTrueAndNextExecutionTimeAfterOrderByNextExecutionTimeAsc(
                        normalizeOrganization(organizationId), now())
                .map(job -> job.getNextExecutionTime().toInstant());
    }

    private void validateSchedule(ScheduleSpec schedule) {
        if (schedule == null) {
            throw new IllegalArgumentException("schedule must not be null");
        }
        if (schedule.cronExpression() != null && !expressionEvaluator.isValid(schedule.cronExpression())) {
            throw new IllegalArgumentException("Invalid cron expression '" + schedule.cronExpression() + "'");
        }
        if (schedule.startBoundary() != null && schedule.endBoundary() != null
                && schedule.endBoundary().isBefore(schedule.startBoundary())) {
            throw new IllegalArgumentException("endBoundary must not be before startBoundary");
        }
    }

    private JsonNode toTask(Object task) {
        if (task == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        JsonNode node = task instanceof JsonNode json ? json : objectMapper.valueToTree(task);
        if (!node.isObject() || node.size() != 1) {
            throw new IllegalArgumentException("task must be an object with exactly one operator key");
        }
        return node;
    }

    private CronJob require(UUID jobId) {
        return jobRepository.findById(requireId(jobId))
                .orElseThrow(() -> new IllegalArgumentException("Unknown cron job " + jobId));
    }

    private static UUID requireId(UUID jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId must not be null");
        }
        return jobId;
    }

    private static String normalizeOrganization(String organizationId) {
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId must not be null or blank");
        }
        return organizationId.trim();
    }

    private void publish(RecordChangeEvent.ChangeType changeType, CronJob job) {
        eventPublisher.publishEvent(new RecordChangeEvent(this, changeType, collection, List.of(job)));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
