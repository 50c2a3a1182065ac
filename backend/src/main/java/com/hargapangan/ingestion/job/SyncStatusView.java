package com.hargapangan.ingestion.job;

import java.time.Instant;

/**
 * Scheduler state for GET /sync/status.
 */
public record SyncStatusView(
        boolean enabled,
        boolean running,
        long cycleCount,
        Instant lastStartedAt,
        Instant lastFinishedAt,
        SyncCycleResult lastResult,
        long intervalMs
) {
}
