package com.cronq;

import com.cronq.config.CronQProperties;
import com.cronq.internal.CronJobEventListener;
import com.cronq.internal.CronJobLifecycle;
import com.cronq.internal.CronTaskDispatcher;
import com.cronq.internal.JobTimerTable;
import com.cronq.internal.LocalWorkerIdentityProvider;
import com.cronq.schedule.CronExpressionEvaluator;
import com.cronq.schedule.RecurrenceResolver;
import com.cronq.schedule.ScheduleSpecMapper;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationExcludeFilter;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.context.event.ApplicationEventMulticaster;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Locale;

@AutoConfiguration(before = { HibernateJpaAutoConfiguration.class, JpaRepositoriesAutoConfiguration.class })
@AutoConfigurationPackage(basePackageClasses = CronJob.class)
@ComponentScan(basePackages = "com.cronq",
        excludeFilters = @ComponentScan.Filter(type = FilterType.CUSTOM, classes = AutoConfigurationExcludeFilter.class))
@EnableScheduling
@EnableConfigurationProperties(CronQProperties.class)
public class CronQAutoConfiguration {

    /**
     * Pool shared by job timers and CronQ's own sweeps. Registered as a
     * non-default candidate so it is only injected by name and the host's
     * {@code @Scheduled} methods keep Spring Boot's default scheduler.
     */
    public static final String TASK_SCHEDULER_BEAN_NAME = "cronqTaskScheduler";

    @Bean
    @ConditionalOnMissingBean(name = "cronqObjectMapper")
    public ObjectMapper cronqObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock cronqClock() {
        return Clock.systemUTC();
    }

    @Bean(name = TASK_SCHEDULER_BEAN_NAME, defaultCandidate = false)
    @ConditionalOnMissingBean(name = TASK_SCHEDULER_BEAN_NAME)
    public ThreadPoolTaskScheduler cronqTaskScheduler(CronQProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, properties.getTimers().getPoolSize()));
        scheduler.setThreadNamePrefix("cronq-timer-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean(destroyMethod = "disarmAll")
    @ConditionalOnMissingBean
    public JobTimerTable cronqJobTimerTable(@Qualifier(TASK_SCHEDULER_BEAN_NAME) TaskScheduler taskScheduler) {
        return new JobTimerTable(taskScheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronExpressionEvaluator cronqExpressionEvaluator() {
        return new CronExpressionEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public RecurrenceResolver cronqRecurrenceResolver(CronExpressionEvaluator evaluator, CronQProperties properties) {
        return new RecurrenceResolver(evaluator, properties.getResolver().getMaxSearchYears());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleSpecMapper cronqScheduleSpecMapper(@Qualifier("cronqObjectMapper") ObjectMapper objectMapper) {
        return new ScheduleSpecMapper(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerIdentityProvider cronqWorkerIdentityProvider(CronQProperties properties) {
        return new LocalWorkerIdentityProvider(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronTaskDispatcher cronqTaskDispatcher(ObjectProvider<CronTaskHandler> handlers,
            CronQProperties properties) {
        return new CronTaskDispatcher(handlers.orderedStream().toList(), properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronJobLifecycle cronqJobLifecycle(
            CronJobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            JobTimerTable timerTable,
            RecurrenceResolver resolver,
            ScheduleSpecMapper scheduleMapper,
            CronTaskDispatcher dispatcher,
            WorkerIdentityProvider identityProvider,
            Clock clock,
            CronQProperties properties) {
        return new CronJobLifecycle(jobRepository, new TransactionTemplate(transactionManager), timerTable, resolver,
                scheduleMapper, dispatcher, identityProvider, clock, properties.getReconciliation().getHorizon());
    }

    @Bean
    @ConditionalOnMissingBean
    public CronJobEventListener cronqJobEventListener(
            ApplicationEventMulticaster applicationEventMulticaster,
            CronJobLifecycle lifecycle,
            JobTimerTable timerTable,
            RecurrenceResolver resolver,
            ScheduleSpecMapper scheduleMapper,
            Clock clock,
            CronQProperties properties) {
        return new CronJobEventListener(applicationEventMulticaster, lifecycle, timerTable, resolver, scheduleMapper,
                clock, properties);
    }

    @Bean
    @ConditionalOnMissingBean(name = "cronqHibernatePropertiesCustomizer")
    public HibernatePropertiesCustomizer cronqHibernatePropertiesCustomizer(CronQProperties properties) {
        return hibernateProperties -> {
            String prefix = CronQSchemaInitializer.normalizePrefix(properties.getDatabase().getTablePrefix());
            if (prefix.isEmpty()) {
                return;
            }
            hibernateProperties.put("hibernate.physical_naming_strategy", new CamelCaseToUnderscoresNamingStrategy() {
                @Override
                public Identifier toPhysicalTableName(Identifier name, JdbcEnvironment jdbcEnvironment) {
                    Identifier physical = super.toPhysicalTableName(name, jdbcEnvironment);
                    if (physical.getText().toLowerCase(Locale.ROOT).startsWith("cronq_")) {
                        return new Identifier(prefix + physical.getText(), physical.isQuoted());
                    }
                    return physical;
                }
            });
        };
    }
}
