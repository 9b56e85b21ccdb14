package com.cronq.internal;

import com.cronq.CronJob;
import com.cronq.CronJobRepository;
import com.cronq.CronJobStatus;
import com.cronq.CronQAutoConfiguration;
import com.cronq.config.CronQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Periodic sweep that brings the local timer table back in line with the
 * persisted jobs: arms near-term work, recovers assignments left behind by a
 * crashed worker, re-resolves pending jobs whose time passed unseen, and drops
 * timers of jobs that were deactivated or deleted.
 */
@Component
@ConditionalOnProperty(prefix = "cronq.reconciliation", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReconciliationLoop {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationLoop.class);

    private final CronJobRepository jobRepository;
    private final CronJobLifecycle lifecycle;
    private final JobTimerTable timerTable;
    private final Clock clock;
    private final Duration horizon;
    private final Duration graceWindow;
    private final int batchSize;
    private final AtomicBoolean sweeping = new AtomicBoolean(false);

    public ReconciliationLoop(
            CronJobRepository jobRepository,
            CronJobLifecycle lifecycle,
            JobTimerTable timerTable,
            CronQProperties properties,
            Clock clock) {
        this.jobRepository = jobRepository;
        this.lifecycle = lifecycle;
        this.timerTable = timerTable;
        this.clock = clock;
        this.horizon = properties.getReconciliation().getHorizon();
        this.graceWindow = properties.getReconciliation().getGraceWindow();
        this.batchSize = Math.max(1, properties.getReconciliation().getBatchSize());
    }

    public record SweepReport(int armed, int recovered, int rescheduled, int disarmed) {
    }

    @Scheduled(fixedDelayString = "${cronq.reconciliation.poll-interval-in-seconds:300}000",
            scheduler = CronQAutoConfiguration.TASK_SCHEDULER_BEAN_NAME)
    public void sweep() {
        if (!sweeping.compareAndSet(false, true)) {
            log.debug("Skipping reconciliation because the previous sweep is still running");
            return;
        }
        try {
            SweepReport report = reconcile();
            if (report.recovered() > 0 || report.rescheduled() > 0) {
                log.info("Reconciliation armed {} job(s), recovered {} stale assignment(s), rescheduled {} missed job(s)",
                        report.armed(), report.recovered(), report.rescheduled());
            } else {
                log.debug("Reconciliation armed {} job(s), disarmed {} timer(s)", report.armed(), report.disarmed());
            }
        } finally {
            sweeping.set(false);
        }
    }

    public SweepReport reconcile() {
        Instant now = clock.instant();
        int disarmed = disarmInactive();
        int armed = armDueJobs(now);
        int recovered = recoverStaleAssignments(now);
        int rescheduled = rescheduleMissedJobs(now);
        return new SweepReport(armed, recovered, rescheduled, disarmed);
    }

    int armDueJobs(Instant now) {
        OffsetDateTime from = CronJobLifecycle.toOffset(now);
        OffsetDateTime to = CronJobLifecycle.toOffset(now.plus(horizon));
        return drain("due", page -> jobRepository.findDueForAssignment(from, to, page), job -> {
            Instant next = job.getNextExecutionTime().toInstant();
            return lifecycle.place(job, next) == CronJobLifecycle.Placement.ARMED;
        });
    }

    int recoverStaleAssignments(Instant now) {
        OffsetDateTime threshold = CronJobLifecycle.toOffset(now.minus(graceWindow));
        return drain("stale", page -> jobRepository.findActiveOverdue(CronJobStatus.ASSIGNED, threshold, page), job -> {
            log.info("Recovering stale assignment of job {} held by {}/{}/{} since {}", job.getId(),
                    job.getClusterId(), job.getServerId(), job.getWorkerId(), job.getNextExecutionTime());
            return lifecycle.place(job, job.getNextExecutionTime().toInstant()) == CronJobLifecycle.Placement.ARMED;
        });
    }

    int rescheduleMissedJobs(Instant now) {
        OffsetDateTime threshold = CronJobLifecycle.toOffset(now);
        return drain("missed", page -> jobRepository.findActiveOverdue(CronJobStatus.PENDING, threshold, page), job -> {
            CronJobLifecycle.Placement placement = lifecycle.resolveAndPlace(job, now);
            log.debug("Missed job {} due at {} re-resolved: {}", job.getId(), job.getNextExecutionTime(), placement);
            return placement != CronJobLifecycle.Placement.CONFLICT;
        });
    }

    int disarmInactive() {
        Set<UUID> armed = timerTable.armedJobIds();
        if (armed.isEmpty()) {
            return 0;
        }
        Set<UUID> stillActive;
        try {
            stillActive = new HashSet<>(jobRepository.findActiveIds(armed));
        } catch (DataAccessException e) {
            log.warn("Could not verify armed timers against persisted jobs", e);
            return 0;
        }
        int disarmed = 0;
        for (UUID jobId : armed) {
            if (!stillActive.contains(jobId) && timerTable.disarm(jobId)) {
                log.debug("Disarmed timer of deleted or inactive job {}", jobId);
                disarmed++;
            }
        }
        return disarmed;
    }

    /**
     * Re-queries the first page while the previous one was full and moved at
     * least one job out of the result set.
     */
    private int drain(String category, Function<Pageable, List<CronJob>> query, Function<CronJob, Boolean> handler) {
        Pageable firstPage = PageRequest.of(0, batchSize);
        int handled = 0;
        while (true) {
            List<CronJob> batch;
            try {
                batch = query.apply(firstPage);
            } catch (DataAccessException e) {
                log.warn("Reconciliation query for {} jobs failed; retrying on the next sweep", category, e);
                return handled;
            }
            int progress = 0;
            for (CronJob job : batch) {
                if (timerTable.isArmed(job.getId())) {
                    continue;
                }
                try {
                    if (handler.apply(job)) {
                        progress++;
                    }
                } catch (DataAccessException e) {
                    log.warn("Persistence error while reconciling job {}; retrying on the next sweep", job.getId(), e);
                }
            }
            handled += progress;
            if (batch.size() < batchSize || progress == 0) {
                return handled;
            }
        }
    }
}
