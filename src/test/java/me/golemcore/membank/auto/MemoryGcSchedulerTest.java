package me.golemcore.membank.auto;

import me.golemcore.membank.domain.model.GcCancellationToken;
import me.golemcore.membank.domain.model.GcPolicy;
import me.golemcore.membank.domain.model.GcSummary;
import me.golemcore.membank.domain.service.MemoryBank;
import me.golemcore.membank.infrastructure.config.MemoryBankProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryGcSchedulerTest {

    private MemoryBank memoryBank;
    private MemoryBankProperties properties;
    private MemoryGcScheduler scheduler;

    @BeforeEach
    void setUp() {
        memoryBank = mock(MemoryBank.class);
        properties = new MemoryBankProperties();
        scheduler = new MemoryGcScheduler(memoryBank, properties);
        when(memoryBank.isRunning()).thenReturn(true);
        when(memoryBank.garbageCollect(any(GcPolicy.class), any(GcCancellationToken.class)))
                .thenReturn(summary(false));
    }

    @Test
    void shouldMapConfiguredDefaultPolicy() {
        MemoryBankProperties.GcPolicyProperties configured = properties.getGc().getDefaultPolicy();
        configured.setName("hourly");
        configured.setArchiveThreshold(0.3);
        configured.setDeleteThreshold(0.05);
        configured.setMaxAge(Duration.ofDays(14));
        configured.setMaxArtifacts(500);
        configured.setDryRun(true);

        GcPolicy policy = scheduler.defaultPolicy();

        assertEquals("hourly", policy.getName());
        assertEquals(0.3, policy.getArchiveThreshold());
        assertEquals(0.05, policy.getDeleteThreshold());
        assertEquals(Duration.ofDays(14), policy.getMaxAge());
        assertEquals(500, policy.getMaxArtifacts());
        assertTrue(policy.isDryRun());
        assertNull(policy.getScope());
    }

    @Test
    void shouldSweepAndSnapshotOnTick() {
        scheduler.tick();

        ArgumentCaptor<GcPolicy> policy = ArgumentCaptor.forClass(GcPolicy.class);
        verify(memoryBank).garbageCollect(policy.capture(), any(GcCancellationToken.class));
        assertEquals("scheduled", policy.getValue().getName());
        verify(memoryBank).snapshotDecay();
        assertFalse(scheduler.isExecuting());
    }

    @Test
    void shouldNotSnapshotWhenDisabled() {
        properties.getGc().setSnapshotDecay(false);

        scheduler.tick();

        verify(memoryBank, never()).snapshotDecay();
    }

    @Test
    void shouldNotSnapshotAfterCancelledSweep() {
        when(memoryBank.garbageCollect(any(GcPolicy.class), any(GcCancellationToken.class)))
                .thenReturn(summary(true));

        scheduler.tick();

        verify(memoryBank, never()).snapshotDecay();
    }

    @Test
    void shouldSkipTickWhenBankIsStopped() {
        when(memoryBank.isRunning()).thenReturn(false);

        scheduler.tick();

        verify(memoryBank, never()).garbageCollect(any(GcPolicy.class), any(GcCancellationToken.class));
    }

    @Test
    void shouldSurviveFailedSweep() {
        when(memoryBank.garbageCollect(any(GcPolicy.class), any(GcCancellationToken.class)))
                .thenThrow(new IllegalStateException("boom"));

        scheduler.tick();

        assertFalse(scheduler.isExecuting());
        verify(memoryBank, never()).snapshotDecay();
    }

    @Test
    void shouldSkipOverlappingTick() throws Exception {
        CountDownLatch sweepStarted = new CountDownLatch(1);
        CountDownLatch releaseSweep = new CountDownLatch(1);
        when(memoryBank.garbageCollect(any(GcPolicy.class), any(GcCancellationToken.class))).thenAnswer(invocation -> {
            sweepStarted.countDown();
            releaseSweep.await(5, TimeUnit.SECONDS);
            return summary(false);
        });

        Thread first = new Thread(scheduler::tick);
        first.start();
        assertTrue(sweepStarted.await(5, TimeUnit.SECONDS));
        assertTrue(scheduler.isExecuting());

        scheduler.tick();
        releaseSweep.countDown();
        first.join(5000);

        verify(memoryBank).garbageCollect(any(GcPolicy.class), any(GcCancellationToken.class));
    }

    @Test
    void shouldCancelInFlightSweepOnShutdown() throws Exception {
        CountDownLatch sweepStarted = new CountDownLatch(1);
        GcCancellationToken[] seen = new GcCancellationToken[1];
        when(memoryBank.garbageCollect(any(GcPolicy.class), any(GcCancellationToken.class))).thenAnswer(invocation -> {
            GcCancellationToken token = invocation.getArgument(1);
            seen[0] = token;
            sweepStarted.countDown();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!token.isCancelled() && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            return summary(token.isCancelled());
        });

        Thread worker = new Thread(scheduler::tick);
        worker.start();
        assertTrue(sweepStarted.await(5, TimeUnit.SECONDS));

        scheduler.shutdown();
        worker.join(5000);

        assertTrue(seen[0].isCancelled());
        verify(memoryBank, never()).snapshotDecay();
    }

    @Test
    void shouldNotScheduleWhenDisabled() {
        scheduler.init();
        scheduler.shutdown();

        verify(memoryBank, never()).isRunning();
    }

    @Test
    void shouldRunScheduledSweepsWhenEnabled() {
        properties.getGc().setEnabled(true);
        properties.getGc().setInitialDelay(Duration.ofMillis(10));
        properties.getGc().setInterval(Duration.ofMinutes(10));

        scheduler.init();
        try {
            verify(memoryBank, timeout(5000)).garbageCollect(any(GcPolicy.class), any(GcCancellationToken.class));
        } finally {
            scheduler.shutdown();
        }
    }

    private static GcSummary summary(boolean cancelled) {
        return GcSummary.builder()
                .policyName("scheduled")
                .cancelled(cancelled)
                .build();
    }
}
