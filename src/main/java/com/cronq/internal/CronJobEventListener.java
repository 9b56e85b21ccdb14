package com.cronq.internal;

import com.cronq.CronJob;
import com.cronq.CronJobStatus;
import com.cronq.RecordChangeEvent;
import com.cronq.config.CronQProperties;
import com.cronq.schedule.RecurrenceResolver;
import com.cronq.schedule.ScheduleSpecMapper;
import com.cronq.schedule.ScheduleUnsatisfiableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationListener;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.ApplicationEventMulticaster;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Keeps timers in step with job changes announced as {@link RecordChangeEvent}s.
 * The subscription is registered on start and removed on stop, so nothing is
 * ingested outside the container's running phase.
 */
public class CronJobEventListener implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CronJobEventListener.class);

    private final ApplicationEventMulticaster multicaster;
    private final CronJobLifecycle lifecycle;
    private final JobTimerTable timerTable;
    private final RecurrenceResolver resolver;
    private final ScheduleSpecMapper scheduleMapper;
    private final Clock clock;
    private final String collection;
    private final ApplicationListener<RecordChangeEvent> subscription = new Subscription();
    private volatile boolean running;

    public CronJobEventListener(
            ApplicationEventMulticaster multicaster,
            CronJobLifecycle lifecycle,
            JobTimerTable timerTable,
            RecurrenceResolver resolver,
            ScheduleSpecMapper scheduleMapper,
            Clock clock,
            CronQProperties properties) {
        this.multicaster = multicaster;
        this.lifecycle = lifecycle;
        this.timerTable = timerTable;
        this.resolver = resolver;
        this.scheduleMapper = scheduleMapper;
        this.clock = clock;
        this.collection = properties.getEvents().getCollection();
    }

    @Override
    public void start() {
        multicaster.addApplicationListener(subscription);
        running = true;
        log.info("Listening for '{}' record changes", collection);
    }

    @Override
    public void stop() {
        multicaster.removeApplicationListener(subscription);
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void onRecordChange(RecordChangeEvent event) {
        if (!running || !collection.equals(event.getCollection())) {
            return;
        }
        Set<UUID> pruned = prune(event);
        if (event.getChangeType() == RecordChangeEvent.ChangeType.DELETE) {
            return;
        }

        Instant now = clock.instant();
        for (CronJob record : event.getRecords()) {
            if (record.getId() == null || pruned.contains(record.getId())) {
                continue;
            }
            try {
                ingest(record, now);
            } catch (DataAccessException e) {
                log.warn("Persistence error while ingesting change of job {}; the next sweep will retry",
                        record.getId(), e);
            } catch (RuntimeException e) {
                log.error("Failed to ingest change of job {}", record.getId(), e);
            }
        }
    }

    private Set<UUID> prune(RecordChangeEvent event) {
        boolean deletion = event.getChangeType() == RecordChangeEvent.ChangeType.DELETE;
        Set<UUID> pruned = new HashSet<>();
        for (CronJob record : event.getRecords()) {
            if (record.getId() != null && (deletion || !record.isActive())) {
                timerTable.disarm(record.getId());
                pruned.add(record.getId());
            }
        }
        if (!pruned.isEmpty()) {
            log.debug("Pruned {} deleted or inactive job(s) from {} batch", pruned.size(), event.getChangeType());
        }
        return pruned;
    }

    private void ingest(CronJob record, Instant now) {
        UUID jobId = record.getId();
        if (record.getStatus() == CronJobStatus.RUNNING) {
            log.debug("Job {} is running; its next occurrence follows from the execution result", jobId);
            return;
        }

        Optional<Instant> next;
        try {
            next = resolver.resolveNext(scheduleMapper.read(record.getSchedule()), now);
        } catch (ScheduleUnsatisfiableException e) {
            lifecycle.markUnsatisfiable(jobId, e.getMessage());
            return;
        }
        if (next.isEmpty()) {
            lifecycle.markExhausted(jobId);
            return;
        }
        if (timerTable.armedFireTime(jobId).filter(next.get()::equals).isPresent()) {
            log.debug("Job {} is already armed for {}", jobId, next.get());
            return;
        }
        CronJobLifecycle.Placement placement = lifecycle.place(record, next.get());
        log.debug("Job {} placed for {}: {}", jobId, next.get(), placement);
    }

    // Named class so the multicaster can resolve the event type.
    private final class Subscription implements ApplicationListener<RecordChangeEvent> {

        @Override
        public void onApplicationEvent(RecordChangeEvent event) {
            onRecordChange(event);
        }
    }
}
