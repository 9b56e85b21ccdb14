package com.cronq.internal;

import com.cronq.CronJobRepository;
import com.cronq.CronJobStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

public class CronQMetrics {

    private static final Logger log = LoggerFactory.getLogger(CronQMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final CronJobRepository jobRepository;
    private final JobTimerTable timerTable;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();

    private volatile Map<CronJobStatus, Long> cachedCounts = Map.of();
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean captured;

    public CronQMetrics(CronJobRepository jobRepository, JobTimerTable timerTable, MeterRegistry meterRegistry) {
        this.jobRepository = jobRepository;
        this.timerTable = timerTable;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering CronQ gauges...");

        for (CronJobStatus status : CronJobStatus.values()) {
            Gauge.builder("cronq.jobs.count", this, metrics -> metrics.countFor(status))
                    .description("Number of CronQ jobs")
                    .tag("status", status.value())
                    .register(meterRegistry);
        }

        Gauge.builder("cronq.jobs.total", this, CronQMetrics::totalCount)
                .description("Total number of CronQ jobs in the database")
                .register(meterRegistry);

        Gauge.builder("cronq.timers.armed", timerTable, JobTimerTable::size)
                .description("Timers currently armed in this process")
                .register(meterRegistry);
    }

    private double countFor(CronJobStatus status) {
        return snapshot().getOrDefault(status, 0L);
    }

    private double totalCount() {
        return snapshot().values().stream().mapToLong(Long::longValue).sum();
    }

    private Map<CronJobStatus, Long> snapshot() {
        long now = System.nanoTime();
        if (captured && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedCounts;
        }
        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (captured && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedCounts;
            }
            cachedCounts = loadCounts();
            snapshotCapturedAtNanos = now;
            captured = true;
            return cachedCounts;
        }
    }

    private Map<CronJobStatus, Long> loadCounts() {
        Map<CronJobStatus, Long> counts = new EnumMap<>(CronJobStatus.class);
        try {
            for (CronJobRepository.StatusCount row : jobRepository.countByStatus()) {
                if (row.getStatus() != null) {
                    counts.put(row.getStatus(), row.getCount() == null ? 0L : row.getCount());
                }
            }
        } catch (Exception e) {
            log.trace("Failed to query status counts for metrics: {}", e.getMessage());
        }
        return counts;
    }
}
