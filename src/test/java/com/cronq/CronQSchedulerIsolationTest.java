package com.cronq;

import com.cronq.config.CronQProperties;
import com.cronq.internal.CronJobCleaner;
import com.cronq.internal.ReconciliationLoop;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.Bean;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.scheduling.annotation.Scheduled;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class CronQSchedulerIsolationTest {

    @Test
    void shouldNotOfferTimerPoolAsDefaultScheduler() throws Exception {
        Bean bean = AnnotatedElementUtils.findMergedAnnotation(
                CronQAutoConfiguration.class.getMethod("cronqTaskScheduler", CronQProperties.class),
                Bean.class);

        assertArrayEquals(new String[] { CronQAutoConfiguration.TASK_SCHEDULER_BEAN_NAME }, bean.name());
        assertFalse(bean.defaultCandidate());
    }

    @Test
    void shouldRunOwnSweepsOnTimerPool() throws Exception {
        Scheduled sweep = ReconciliationLoop.class.getMethod("sweep").getAnnotation(Scheduled.class);
        Scheduled cleanup = CronJobCleaner.class.getMethod("cleanup").getAnnotation(Scheduled.class);

        assertEquals(CronQAutoConfiguration.TASK_SCHEDULER_BEAN_NAME, sweep.scheduler());
        assertEquals(CronQAutoConfiguration.TASK_SCHEDULER_BEAN_NAME, cleanup.scheduler());
    }
}
