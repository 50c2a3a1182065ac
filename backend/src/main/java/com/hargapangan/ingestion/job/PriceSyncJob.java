package com.hargapangan.ingestion.job;

import com.hargapangan.audit.Actor;
import com.hargapangan.ingestion.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic price sync (hargapangan.sync.interval-ms, default 6h) plus the manual trigger. At most one
 * cycle runs at a time in this process: a scheduled tick that finds a cycle running is skipped, a
 * manual trigger fails with SYNC_IN_PROGRESS.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PriceSyncJob {

    public static final String SYNC_IN_PROGRESS = "SYNC_IN_PROGRESS";

    private final PriceSyncService priceSyncService;
    private final SyncProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong cycleCount = new AtomicLong();
    private volatile Instant lastStartedAt;
    private volatile Instant lastFinishedAt;
    private volatile SyncCycleResult lastResult;

    @Scheduled(
            fixedRateString = "${hargapangan.sync.interval-ms:21600000}",
            initialDelayString = "${hargapangan.sync.initial-delay-ms:30000}")
    public void runScheduled() {
        if (!properties.isEnabled()) {
            log.debug("Scheduled price sync disabled");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.info("Price sync already running; skipping scheduled tick");
            return;
        }
        try {
            execute(SyncOptions.from(properties), Actor.system());
        } catch (Exception e) {
            log.error("Scheduled price sync failed", e);
        } finally {
            running.set(false);
        }
    }

    /**
     * Runs a cycle synchronously on the caller's thread.
     *
     * @throws PriceSyncException SYNC_IN_PROGRESS if a cycle is already running
     */
    public SyncCycleResult triggerNow(SyncOptions options, Actor actor) {
        if (!running.compareAndSet(false, true)) {
            throw new PriceSyncException(SYNC_IN_PROGRESS, "A sync cycle is already running");
        }
        try {
            log.info("Manual price sync triggered by {}", actor.id());
            return execute(options, actor);
        } finally {
            running.set(false);
        }
    }

    public SyncOptions defaultOptions() {
        return SyncOptions.from(properties);
    }

    public SyncStatusView status() {
        return new SyncStatusView(properties.isEnabled(), running.get(), cycleCount.get(),
                lastStartedAt, lastFinishedAt, lastResult, properties.getIntervalMs());
    }

    public boolean isRunning() {
        return running.get();
    }

    private SyncCycleResult execute(SyncOptions options, Actor actor) {
        lastStartedAt = Instant.now(clock);
        try {
            SyncCycleResult result = priceSyncService.runCycle(options, actor);
            lastResult = result;
            return result;
        } finally {
            lastFinishedAt = Instant.now(clock);
            cycleCount.incrementAndGet();
        }
    }
}
