package com.cronq.internal;

import com.cronq.CronJobRepository;
import com.cronq.config.CronQProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CronJobCleanerTest {

    @Configuration
    @EnableConfigurationProperties(CronQProperties.class)
    static class Config {
    }

    private static final Instant NOW = Instant.parse("2024-09-10T10:00:00Z");

    private final CronJobRepository jobRepository = mock(CronJobRepository.class);
    private final CronQProperties properties = new CronQProperties();
    private final CronJobCleaner cleaner = new CronJobCleaner(jobRepository, properties, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void shouldDoNothingWithoutRetention() {
        cleaner.cleanup();

        verify(jobRepository, never()).deleteByActiveFalseAndUpdatedAtBefore(any());
    }

    @Test
    void shouldDeleteInactiveJobsOlderThanRetention() {
        properties.getCleanup().setDeleteInactiveJobsAfter("7d");
        OffsetDateTime threshold = OffsetDateTime.ofInstant(NOW.minus(Duration.ofDays(7)), ZoneOffset.UTC);
        when(jobRepository.deleteByActiveFalseAndUpdatedAtBefore(threshold)).thenReturn(4);

        cleaner.cleanup();

        verify(jobRepository).deleteByActiveFalseAndUpdatedAtBefore(threshold);
    }

    @Test
    void shouldParseShorthandAndIsoDurations() {
        assertEquals(Duration.ofHours(36), CronJobCleaner.parseDuration("36h"));
        assertEquals(Duration.ofDays(7), CronJobCleaner.parseDuration(" 7D "));
        assertEquals(Duration.ofMinutes(90), CronJobCleaner.parseDuration("PT90M"));
        assertThrows(IllegalArgumentException.class, () -> CronJobCleaner.parseDuration("3w"));
    }

    @Test
    void shouldStayRegisteredWhenReconciliationIsDisabled() {
        new ApplicationContextRunner()
                .withPropertyValues("cronq.reconciliation.enabled=false")
                .withUserConfiguration(Config.class, CronJobCleaner.class)
                .withBean(CronJobRepository.class, () -> jobRepository)
                .withBean(Clock.class, () -> Clock.fixed(NOW, ZoneOffset.UTC))
                .run(context -> assertFalse(context.getBeansOfType(CronJobCleaner.class).isEmpty()));
    }
}
