package com.cronq.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronQPropertiesTest {

    @Configuration
    @EnableConfigurationProperties(CronQProperties.class)
    static class Config {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(Config.class);

    @Test
    void shouldMapDefaultCronqProperties() {
        contextRunner.run(context -> {
            CronQProperties properties = context.getBean(CronQProperties.class);
            assertTrue(properties.getReconciliation().isEnabled());
            assertEquals(300, properties.getReconciliation().getPollIntervalInSeconds());
            assertEquals(Duration.ofMinutes(5), properties.getReconciliation().getHorizon());
            assertEquals(Duration.ofMinutes(1), properties.getReconciliation().getGraceWindow());
            assertEquals(500, properties.getReconciliation().getBatchSize());
            assertEquals(4, properties.getResolver().getMaxSearchYears());
            assertEquals(2, properties.getTimers().getPoolSize());
            assertTrue(properties.getExecution().getWorkerCount() >= 2);
            assertEquals("default", properties.getIdentity().getClusterId());
            assertEquals("cron-job", properties.getEvents().getCollection());
            assertFalse(properties.getDatabase().isSkipCreate());
            assertTrue(properties.getDatabase().isFailOnMigrationError());
            assertEquals("", properties.getCleanup().getDeleteInactiveJobsAfter());
        });
    }

    @Test
    void shouldMapCustomCronqProperties() {
        contextRunner
                .withPropertyValues(
                        "cronq.reconciliation.enabled=false",
                        "cronq.reconciliation.poll-interval-in-seconds=30",
                        "cronq.reconciliation.horizon=2m",
                        "cronq.reconciliation.grace-window=15s",
                        "cronq.reconciliation.batch-size=50",
                        "cronq.resolver.max-search-years=8",
                        "cronq.timers.pool-size=4",
                        "cronq.execution.worker-count=6",
                        "cronq.identity.cluster-id=eu-west",
                        "cronq.identity.server-id=node-7",
                        "cronq.events.collection=scheduled-task",
                        "cronq.database.table-prefix=tenant1_",
                        "cronq.cleanup.delete-inactive-jobs-after=7d")
                .run(context -> {
                    CronQProperties properties = context.getBean(CronQProperties.class);
                    assertFalse(properties.getReconciliation().isEnabled());
                    assertEquals(30, properties.getReconciliation().getPollIntervalInSeconds());
                    assertEquals(Duration.ofMinutes(2), properties.getReconciliation().getHorizon());
                    assertEquals(Duration.ofSeconds(15), properties.getReconciliation().getGraceWindow());
                    assertEquals(50, properties.getReconciliation().getBatchSize());
                    assertEquals(8, properties.getResolver().getMaxSearchYears());
                    assertEquals(4, properties.getTimers().getPoolSize());
                    assertEquals(6, properties.getExecution().getWorkerCount());
                    assertEquals("eu-west", properties.getIdentity().getClusterId());
                    assertEquals("node-7", properties.getIdentity().getServerId());
                    assertEquals("scheduled-task", properties.getEvents().getCollection());
                    assertEquals("tenant1_", properties.getDatabase().getTablePrefix());
                    assertEquals("7d", properties.getCleanup().getDeleteInactiveJobsAfter());
                });
    }
}
