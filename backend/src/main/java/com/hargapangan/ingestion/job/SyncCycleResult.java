package com.hargapangan.ingestion.job;

import com.hargapangan.ingestion.reconcile.ReconcileResult;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Outcome of one sync cycle. reconcile is null when the upstream could not be reached.
 */
public record SyncCycleResult(
        boolean success,
        String message,
        LocalDate date,
        String level,
        int received,
        int regionsCreated,
        int overridesExpired,
        ReconcileResult reconcile,
        Instant startedAt,
        Instant finishedAt
) {
}
