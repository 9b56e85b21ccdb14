package com.cronq;

import com.cronq.internal.CronQMetrics;
import com.cronq.internal.JobTimerTable;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.context.annotation.Bean;

/**
 * Registers CronQ gauges once a {@link MeterRegistry} is available.
 */
@AutoConfiguration(after = CronQAutoConfiguration.class, afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration" })
@ConditionalOnClass(MeterRegistry.class)
public class CronQMetricsAutoConfiguration {

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    public CronQMetrics cronqMetrics(CronJobRepository jobRepository, JobTimerTable timerTable,
            MeterRegistry meterRegistry) {
        return new CronQMetrics(jobRepository, timerTable, meterRegistry);
    }
}
