package com.cronq.internal;

import com.cronq.CronJobRepository;
import com.cronq.CronQAutoConfiguration;
import com.cronq.config.CronQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Locale;

/**
 * Deletes jobs that have been inactive for longer than
 * {@code cronq.cleanup.delete-inactive-jobs-after}. Does nothing while that
 * property is blank.
 */
@Component
public class CronJobCleaner {

    private static final Logger log = LoggerFactory.getLogger(CronJobCleaner.class);

    private final CronJobRepository jobRepository;
    private final CronQProperties properties;
    private final Clock clock;

    public CronJobCleaner(CronJobRepository jobRepository, CronQProperties properties, Clock clock) {
        this.jobRepository = jobRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelay = 3600000, scheduler = CronQAutoConfiguration.TASK_SCHEDULER_BEAN_NAME)
    public void cleanup() {
        String retentionValue = properties.getCleanup().getDeleteInactiveJobsAfter();
        if (retentionValue == null || retentionValue.isBlank()) {
            return;
        }

        try {
            Duration retention = parseDuration(retentionValue);
            OffsetDateTime threshold = OffsetDateTime.ofInstant(clock.instant().minus(retention), ZoneOffset.UTC);
            int deleted = jobRepository.deleteByActiveFalseAndUpdatedAtBefore(threshold);
            if (deleted > 0) {
                log.info("Cleaned up {} inactive cron jobs older than {}", deleted, retention);
            }
        } catch (Exception e) {
            log.error("Failed to clean up inactive cron jobs: {}", e.getMessage());
        }
    }

    static Duration parseDuration(String value) {
        String trimmed = value.trim();
        if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
            return Duration.parse(trimmed);
        }
        // "36h", "7d"
        String shorthand = trimmed.toLowerCase(Locale.ROOT);
        long amount = Long.parseLong(shorthand.substring(0, shorthand.length() - 1));
        if (shorthand.endsWith("h")) {
            return Duration.ofHours(amount);
        }
        if (shorthand.endsWith("d")) {
            return Duration.ofDays(amount);
        }
        throw new IllegalArgumentException("Unsupported duration value: " + value);
    }
}
