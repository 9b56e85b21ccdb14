package com.cronq.internal;

import com.cronq.CronJob;
import com.cronq.CronJobRepository;
import com.cronq.CronJobStatus;
import com.cronq.ExecutionResult;
import com.cronq.RetryPolicy;
import com.cronq.WorkerIdentityProvider;
import com.cronq.schedule.RecurrenceResolver;
import com.cronq.schedule.ScheduleSpec;
import com.cronq.schedule.ScheduleSpecMapper;
import com.cronq.schedule.ScheduleUnsatisfiableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives a job through {@code pending → assigned → running → completed|failed → pending}.
 * <p>
 * Every transition is written with a compare-and-set on the record version, so
 * a path working from an outdated snapshot loses instead of overwriting newer
 * state. Persisted state wins over local timers: a fired timer re-reads its job
 * and does nothing unless the job is still active and assigned.
 */
public class CronJobLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CronJobLifecycle.class);

    private final CronJobRepository jobRepository;
    private final TransactionTemplate transactionTemplate;
    private final JobTimerTable timerTable;
    private final RecurrenceResolver resolver;
    private final ScheduleSpecMapper scheduleMapper;
    private final CronTaskDispatcher dispatcher;
    private final WorkerIdentityProvider identityProvider;
    private final Clock clock;
    private final Duration horizon;

    public CronJobLifecycle(
            CronJobRepository jobRepository,
            TransactionTemplate transactionTemplate,
            JobTimerTable timerTable,
            RecurrenceResolver resolver,
            ScheduleSpecMapper scheduleMapper,
            CronTaskDispatcher dispatcher,
            WorkerIdentityProvider identityProvider,
            Clock clock,
            Duration horizon) {
        this.jobRepository = jobRepository;
        this.transactionTemplate = transactionTemplate;
        this.timerTable = timerTable;
        this.resolver = resolver;
        this.scheduleMapper = scheduleMapper;
        this.dispatcher = dispatcher;
        this.identityProvider = identityProvider;
        this.clock = clock;
        this.horizon = horizon;
    }

    public enum Placement {
        /** Claimed as {@code assigned} and armed locally. */
        ARMED,
        /** Left {@code pending} for a later sweep. */
        DEFERRED,
        /** The record changed since it was read; nothing was written. */
        CONFLICT,
        /** No occurrence remains; the job was deactivated. */
        EXHAUSTED,
        /** The schedule cannot be satisfied; the job was marked failed. */
        UNSATISFIABLE
    }

    /**
     * Resolves the next occurrence of {@code snapshot} from {@code now} and places it.
     */
    public Placement resolveAndPlace(CronJob snapshot, Instant now) {
        Optional<Instant> next;
        try {
            ScheduleSpec schedule = scheduleMapper.read(snapshot.getSchedule());
            next = resolver.resolveNext(schedule, now);
        } catch (ScheduleUnsatisfiableException e) {
            markUnsatisfiable(snapshot.getId(), e.getMessage());
            return Placement.UNSATISFIABLE;
        }
        if (next.isEmpty()) {
            markExhausted(snapshot.getId());
            return Placement.EXHAUSTED;
        }
        return place(snapshot, next.get());
    }

    /**
     * Claims and arms the job when {@code next} is within the near-term horizon,
     * otherwise records it as {@code pending} and drops any local timer.
     */
    public Placement place(CronJob snapshot, Instant next) {
        UUID jobId = snapshot.getId();
        if (snapshot.getStatus() == CronJobStatus.RUNNING) {
            log.debug("Job {} is running; its next occurrence is placed when it finishes", jobId);
            return Placement.CONFLICT;
        }
        Instant now = clock.instant();
        OffsetDateTime nextAt = toOffset(next);

        if (next.isAfter(now.plus(horizon))) {
            timerTable.disarm(jobId);
            if (snapshot.getStatus() == CronJobStatus.PENDING && nextAt.isEqual(orEpoch(snapshot.getNextExecutionTime()))) {
                return Placement.DEFERRED;
            }
            int updated = inTransaction(() -> jobRepository.defer(jobId, snapshot.getVersion(), nextAt, toOffset(now)));
            if (updated == 0) {
                return onConflict(jobId);
            }
            log.debug("Job {} deferred to {}", jobId, next);
            return Placement.DEFERRED;
        }

        int updated = inTransaction(() -> jobRepository.claim(jobId, snapshot.getVersion(), nextAt,
                identityProvider.currentIdentity(), toOffset(now)));
        if (updated == 0) {
            return onConflict(jobId);
        }
        timerTable.arm(jobId, next, this::onTimerFired);
        return Placement.ARMED;
    }

    /**
     * Timer callback: {@code assigned → running}, then hands the task to the dispatcher.
     */
    public void onTimerFired(UUID jobId, Instant scheduledAt) {
        Optional<CronJob> current;
        try {
            current = jobRepository.findById(jobId);
        } catch (DataAccessException e) {
            log.warn("Could not load job {} at fire time; it will be recovered as a stale assignment", jobId, e);
            return;
        }
        if (current.isEmpty() || !current.get().isActive()) {
            log.debug("Skipping execution of job {}: deleted or inactive", jobId);
            return;
        }
        CronJob job = current.get();
        if (job.getStatus() != CronJobStatus.ASSIGNED) {
            log.debug("Skipping execution of job {}: status is {}", jobId, job.getStatus());
            return;
        }

        Instant now = clock.instant();
        int updated;
        try {
            updated = inTransaction(() -> jobRepository.markRunning(jobId, job.getVersion(), toOffset(now)));
        } catch (DataAccessException e) {
            log.warn("Could not mark job {} as running; it will be recovered as a stale assignment", jobId, e);
            return;
        }
        if (updated == 0) {
            log.debug("Job {} was re-resolved by another path before it could run", jobId);
            return;
        }

        log.debug("Executing job {} of organization {} scheduled at {}", jobId, job.getOrganizationId(), scheduledAt);
        dispatcher.dispatch(jobId, job.getTask()).whenComplete((result, error) -> {
            ExecutionResult outcome = error == null
                    ? result
                    : ExecutionResult.failure(error.getMessage() == null ? error.getClass().getName() : error.getMessage());
            onExecutionFinished(jobId, scheduledAt, outcome);
        });
    }

    /**
     * {@code running → pending | assigned (retry) | completed | failed}.
     */
    public void onExecutionFinished(UUID jobId, Instant firedAt, ExecutionResult result) {
        Instant now = clock.instant();
        Continuation continuation;
        try {
            continuation = transactionTemplate.execute(status -> jobRepository.findById(jobId)
                    .map(job -> applyResult(job, firedAt, result, now))
                    .orElse(null));
        } catch (DataAccessException e) {
            log.error("Failed to record the result of job {}", jobId, e);
            return;
        }
        if (continuation == null) {
            return;
        }

        try {
            if (continuation.rearmAt() != null) {
                timerTable.arm(jobId, continuation.rearmAt(), this::onTimerFired);
            } else if (continuation.next() != null) {
                place(continuation.job(), continuation.next());
            }
        } catch (DataAccessException e) {
            log.warn("Could not assign next occurrence of job {}; the next sweep will pick it up", jobId, e);
        }
    }

    private Continuation applyResult(CronJob job, Instant firedAt, ExecutionResult result, Instant now) {
        if (!job.isActive() || job.getStatus() != CronJobStatus.RUNNING) {
            log.debug("Discarding result of job {}: status {} active {}", job.getId(), job.getStatus(), job.isActive());
            return null;
        }
        OffsetDateTime nowAt = toOffset(now);
        job.setUpdatedAt(nowAt);

        if (!result.isSuccess()) {
            RetryPolicy retryPolicy = job.getRetryPolicy();
            if (retryPolicy != null && job.getRetryCount() < retryPolicy.retries()) {
                job.incrementRetryCount();
                if (job.getOccurrenceTime() == null) {
                    job.setOccurrenceTime(toOffset(firedAt));
                }
                Instant retryAt = now.plus(retryPolicy.retryInterval());
                job.recordLog(nowAt, CronJobStatus.FAILED, result.message());
                job.setStatus(CronJobStatus.ASSIGNED);
                job.setNextExecutionTime(toOffset(retryAt));
                job.assignTo(identityProvider.currentIdentity());
                CronJob saved = jobRepository.save(job);
                log.info("Job {} failed ({}); retry {} of {} at {}", job.getId(), result.message(),
                        job.getRetryCount(), retryPolicy.retries(), retryAt);
                return new Continuation(saved, null, retryAt);
            }
            log.warn("Job {} failed: {}", job.getId(), result.message());
        }

        CronJobStatus outcome = result.isSuccess() ? CronJobStatus.COMPLETED : CronJobStatus.FAILED;
        job.recordLog(nowAt, outcome, result.message());
        job.setRetryCount(0);
        // A retry fires later than the occurrence it repeats.
        Instant occurrence = job.getOccurrenceTime() == null ? firedAt : job.getOccurrenceTime().toInstant();
        job.setOccurrenceTime(null);

        Optional<Instant> following;
        try {
            following = resolver.resolveFollowing(scheduleMapper.read(job.getSchedule()), occurrence, now);
        } catch (ScheduleUnsatisfiableException e) {
            log.warn("Job {} has no satisfiable next occurrence: {}", job.getId(), e.getMessage());
            job.setStatus(CronJobStatus.FAILED);
            job.setNextExecutionTime(null);
            job.setLogMessage(e.getMessage());
            jobRepository.save(job);
            return null;
        }

        if (following.isEmpty()) {
            job.setActive(false);
            job.setStatus(outcome);
            jobRepository.save(job);
            log.info("Job {} finished its schedule with status {}", job.getId(), outcome.value());
            return null;
        }

        job.setStatus(CronJobStatus.PENDING);
        job.setNextExecutionTime(toOffset(following.get()));
        CronJob saved = jobRepository.save(job);
        return new Continuation(saved, following.get(), null);
    }

    /**
     * Deactivates a job whose schedule has no further occurrence.
     */
    public void markExhausted(UUID jobId) {
        timerTable.disarm(jobId);
        Instant now = clock.instant();
        inTransaction(() -> jobRepository.findById(jobId).map(job -> {
            if (!job.isActive()) {
                return 0;
            }
            job.setActive(false);
            job.setStatus(CronJobStatus.COMPLETED);
            job.setUpdatedAt(toOffset(now));
            jobRepository.save(job);
            return 1;
        }).orElse(0));
        log.info("Job {} has no remaining occurrences and was deactivated", jobId);
    }

    /**
     * Marks a job failed and leaves it for operator inspection.
     */
    public void markUnsatisfiable(UUID jobId, String reason) {
        timerTable.disarm(jobId);
        Instant now = clock.instant();
        inTransaction(() -> jobRepository.findById(jobId).map(job -> {
            job.setStatus(CronJobStatus.FAILED);
            job.setNextExecutionTime(null);
            job.recordLog(toOffset(now), CronJobStatus.FAILED, reason);
            job.setUpdatedAt(toOffset(now));
            jobRepository.save(job);
            return 1;
        }).orElse(0));
        log.warn("Job {} has an unsatisfiable schedule: {}", jobId, reason);
    }

    private Placement onConflict(UUID jobId) {
        if (jobRepository.findActiveIds(List.of(jobId)).isEmpty()) {
            timerTable.disarm(jobId);
            log.debug("Job {} was deleted or deactivated while being placed", jobId);
        } else {
            log.debug("Job {} changed while being placed; keeping the newer state", jobId);
        }
        return Placement.CONFLICT;
    }

    private int inTransaction(Supplier<Integer> work) {
        Integer updated = transactionTemplate.execute(status -> work.get());
        return updated == null ? 0 : updated;
    }

    private static OffsetDateTime orEpoch(OffsetDateTime value) {
        return value == null ? OffsetDateTime.MIN : value;
    }

    static OffsetDateTime toOffset(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private record Continuation(CronJob job, Instant next, Instant rearmAt) {
    }
}
