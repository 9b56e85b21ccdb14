package com.cronq.internal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobTimerTableTest {

    private static final Instant FIRE_AT = Instant.parse("2024-09-11T02:00:00Z");

    private final List<Runnable> scheduled = new ArrayList<>();
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();
    private final List<UUID> fired = new ArrayList<>();
    private JobTimerTable timerTable;

    @BeforeEach
    void setUp() {
        TaskScheduler taskScheduler = mock(TaskScheduler.class);
        when(taskScheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(invocation -> {
            scheduled.add(invocation.getArgument(0));
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            futures.add(future);
            return future;
        });
        timerTable = new JobTimerTable(taskScheduler);
    }

    @Test
    void shouldFireCallbackOnceAndRemoveEntryBeforeCallbackRuns() {
        UUID jobId = UUID.randomUUID();
        List<Boolean> armedDuringCallback = new ArrayList<>();
        timerTable.arm(jobId, FIRE_AT, (id, at) -> {
            armedDuringCallback.add(timerTable.isArmed(id));
            fired.add(id);
        });

        scheduled.get(0).run();
        scheduled.get(0).run();

        assertEquals(List.of(jobId), fired);
        assertEquals(List.of(false), armedDuringCallback);
        assertFalse(timerTable.isArmed(jobId));
    }

    @Test
    void shouldReplaceExistingTimerWithoutFiringTheOldOne() {
        UUID jobId = UUID.randomUUID();
        List<Instant> firedAt = new ArrayList<>();
        timerTable.arm(jobId, FIRE_AT, (id, at) -> firedAt.add(at));
        timerTable.arm(jobId, FIRE_AT.plusSeconds(60), (id, at) -> firedAt.add(at));

        verify(futures.get(0)).cancel(false);
        assertEquals(1, timerTable.size());
        assertEquals(Optional.of(FIRE_AT.plusSeconds(60)), timerTable.armedFireTime(jobId));

        scheduled.get(0).run();
        assertTrue(firedAt.isEmpty());
        assertTrue(timerTable.isArmed(jobId));

        scheduled.get(1).run();
        assertEquals(List.of(FIRE_AT.plusSeconds(60)), firedAt);
    }

    @Test
    void shouldAllowCallbackToRearmSameJob() {
        UUID jobId = UUID.randomUUID();
        timerTable.arm(jobId, FIRE_AT, (id, at) -> timerTable.arm(id, at.plusSeconds(3600), (again, next) -> fired.add(again)));

        scheduled.get(0).run();

        assertEquals(Optional.of(FIRE_AT.plusSeconds(3600)), timerTable.armedFireTime(jobId));
        scheduled.get(1).run();
        assertEquals(List.of(jobId), fired);
    }

    @Test
    void shouldIgnoreDisarmOfUnknownJob() {
        assertFalse(timerTable.disarm(UUID.randomUUID()));
    }

    @Test
    void shouldNotFireDisarmedTimer() {
        UUID jobId = UUID.randomUUID();
        timerTable.arm(jobId, FIRE_AT, (id, at) -> fired.add(id));

        assertTrue(timerTable.disarm(jobId));
        verify(futures.get(0)).cancel(false);
        scheduled.get(0).run();

        assertTrue(fired.isEmpty());
    }

    @Test
    void shouldContainCallbackFailures() {
        UUID jobId = UUID.randomUUID();
        timerTable.arm(jobId, FIRE_AT, (id, at) -> {
            throw new IllegalStateException("boom");
        });

        assertDoesNotThrow(() -> scheduled.get(0).run());
        assertFalse(timerTable.isArmed(jobId));
    }

    @Test
    void shouldDisarmEverything() {
        timerTable.arm(UUID.randomUUID(), FIRE_AT, (id, at) -> fired.add(id));
        timerTable.arm(UUID.randomUUID(), FIRE_AT, (id, at) -> fired.add(id));

        timerTable.disarmAll();

        assertEquals(0, timerTable.size());
        assertTrue(timerTable.armedJobIds().isEmpty());
        scheduled.forEach(Runnable::run);
        assertTrue(fired.isEmpty());
    }
}
