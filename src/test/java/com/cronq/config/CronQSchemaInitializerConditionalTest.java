package com.cronq.config;

import com.cronq.CronQSchemaInitializer;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class CronQSchemaInitializerConditionalTest {

    @Configuration
    @EnableConfigurationProperties(CronQProperties.class)
    static class Config {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withPropertyValues("cronq.database.fail-on-migration-error=false")
            .withUserConfiguration(Config.class, CronQSchemaInitializer.class)
            .withBean(DataSource.class, () -> mock(DataSource.class));

    @Test
    void shouldCreateSchemaInitializerByDefault() {
        contextRunner.run(context -> assertFalse(context.getBeansOfType(CronQSchemaInitializer.class).isEmpty()));
    }

    @Test
    void shouldSkipSchemaInitializerWhenConfigured() {
        contextRunner.withPropertyValues("cronq.database.skip-create=true")
                .run(context -> assertTrue(context.getBeansOfType(CronQSchemaInitializer.class).isEmpty()));
    }

    @Test
    void shouldFailStartupWhenMigrationFailsByDefault() {
        contextRunner.withPropertyValues("cronq.database.fail-on-migration-error=true")
                .run(context -> assertTrue(context.getStartupFailure() != null));
    }
}
