package com.cronq.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local table of armed timers, at most one per job id.
 * <p>
 * Arming and disarming are atomic per job id. A fired entry removes itself
 * before its callback runs, so the callback may arm the same id again. An entry
 * that was replaced or disarmed never invokes its callback, even if its
 * scheduled task already started.
 */
public class JobTimerTable {

    private static final Logger log = LoggerFactory.getLogger(JobTimerTable.class);

    private final TaskScheduler taskScheduler;
    private final ConcurrentHashMap<UUID, TimerEntry> entries = new ConcurrentHashMap<>();

    public JobTimerTable(TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    /**
     * Arms a timer for {@code jobId}, replacing any timer already armed for it.
     * An instant in the past fires as soon as a scheduler thread is free.
     */
    public void arm(UUID jobId, Instant fireAt, TimerCallback callback) {
        entries.compute(jobId, (id, existing) -> {
            if (existing != null) {
                existing.cancel();
                log.debug("Replacing timer of job {} armed for {}", id, existing.fireAt());
            }
            TimerEntry entry = new TimerEntry(id, fireAt, callback);
            entry.future = taskScheduler.schedule(() -> fire(entry), fireAt);
            return entry;
        });
        log.debug("Armed timer for job {} at {}", jobId, fireAt);
    }

    /**
     * Cancels the timer of {@code jobId}. Unknown ids are ignored.
     *
     * @return whether a timer was armed
     */
    public boolean disarm(UUID jobId) {
        TimerEntry removed = entries.remove(jobId);
        if (removed == null) {
            return false;
        }
        removed.cancel();
        log.debug("Disarmed timer for job {}", jobId);
        return true;
    }

    public boolean isArmed(UUID jobId) {
        return entries.containsKey(jobId);
    }

    public Optional<Instant> armedFireTime(UUID jobId) {
        TimerEntry entry = entries.get(jobId);
        return entry == null ? Optional.empty() : Optional.of(entry.fireAt());
    }

    public Set<UUID> armedJobIds() {
        return Set.copyOf(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public void disarmAll() {
        for (UUID jobId : armedJobIds()) {
            disarm(jobId);
        }
    }

    private void fire(TimerEntry entry) {
        if (!entries.remove(entry.jobId(), entry)) {
            log.debug("Dropping stale timer of job {} scheduled for {}", entry.jobId(), entry.fireAt());
            return;
        }
        if (!entry.claimFire()) {
            return;
        }
        try {
            entry.callback().onFire(entry.jobId(), entry.fireAt());
        } catch (Exception e) {
            log.error("Timer callback failed for job {}", entry.jobId(), e);
        }
    }

    /**
     * Invoked once when an armed timer fires.
     */
    @FunctionalInterface
    public interface TimerCallback {
        void onFire(UUID jobId, Instant scheduledAt);
    }

    private static final class TimerEntry {
        private final UUID jobId;
        private final Instant fireAt;
        private final TimerCallback callback;
        private final AtomicBoolean fired = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> future;

        private TimerEntry(UUID jobId, Instant fireAt, TimerCallback callback) {
            this.jobId = jobId;
            this.fireAt = fireAt;
            this.callback = callback;
        }

        UUID jobId() {
            return jobId;
        }

        Instant fireAt() {
            return fireAt;
        }

        TimerCallback callback() {
            return callback;
        }

        boolean claimFire() {
            return fired.compareAndSet(false, true);
        }

        void cancel() {
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
