package me.golemcore.membank.auto;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.membank.domain.model.GcCancellationToken;
import me.golemcore.membank.domain.model.GcPolicy;
import me.golemcore.membank.domain.model.GcSummary;
import me.golemcore.membank.domain.service.MemoryBank;
import me.golemcore.membank.infrastructure.config.MemoryBankProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Background garbage collection for the memory bank.
 *
 * <p>
 * When {@code membank.gc.enabled=true}, a daemon thread runs the configured
 * default policy at a fixed interval and, if {@code membank.gc.snapshot-decay}
 * is set, writes a decay snapshot after each sweep. A tick that fires while the
 * previous one is still running is skipped. Shutdown cancels the in-flight
 * sweep between artifacts.
 *
 * @since 1.0
 * @see MemoryBank#garbageCollect(GcPolicy, GcCancellationToken)
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MemoryGcScheduler {

    private final MemoryBank memoryBank;
    private final MemoryBankProperties properties;

    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final AtomicReference<GcCancellationToken> inFlight = new AtomicReference<>();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    @PostConstruct
    public void init() {
        MemoryBankProperties.GcProperties gc = properties.getGc();
        if (!gc.isEnabled()) {
            log.info("[MemoryGc] Scheduled garbage collection disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "membank-gc");
            t.setDaemon(true);
            return t;
        });
        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                gc.getInitialDelay().toMillis(),
                gc.getInterval().toMillis(),
                TimeUnit.MILLISECONDS);

        log.info("[MemoryGc] Scheduler started: interval={}, initial delay={}", gc.getInterval(),
                gc.getInitialDelay());
    }

    @PreDestroy
    public void shutdown() {
        GcCancellationToken token = inFlight.get();
        if (token != null) {
            token.cancel();
        }
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[MemoryGc] Scheduler shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[MemoryGc] Tick skipped: previous sweep still in progress");
            return;
        }
        GcCancellationToken token = new GcCancellationToken();
        inFlight.set(token);
        try {
            if (!memoryBank.isRunning()) {
                return;
            }
            GcSummary summary = memoryBank.garbageCollect(defaultPolicy(), token);
            if (properties.getGc().isSnapshotDecay() && !summary.isCancelled()) {
                memoryBank.snapshotDecay();
            }
        } catch (RuntimeException e) { // NOSONAR - a failed tick must not kill the schedule
            log.error("[MemoryGc] Scheduled sweep failed", e);
        } finally {
            inFlight.set(null);
            executing.set(false);
        }
    }

    GcPolicy defaultPolicy() {
        MemoryBankProperties.GcPolicyProperties configured = properties.getGc().getDefaultPolicy();
        return GcPolicy.builder()
                .name(configured.getName())
                .archiveThreshold(configured.getArchiveThreshold())
                .deleteThreshold(configured.getDeleteThreshold())
                .maxAge(configured.getMaxAge())
                .maxArtifacts(configured.getMaxArtifacts())
                .dryRun(configured.isDryRun())
                .build();
    }

    boolean isExecuting() {
        return executing.get();
    }
}
