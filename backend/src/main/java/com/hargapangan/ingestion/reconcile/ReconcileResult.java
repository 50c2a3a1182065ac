package com.hargapangan.ingestion.reconcile;

import java.util.List;

/**
 * Outcome of reconciling one snapshot: rows written or confirmed, rows skipped, and the first
 * few per-row error messages.
 */
public record ReconcileResult(int savedCount, int skippedCount, int errorCount, List<String> errors) {

    public static ReconcileResult empty() {
        return new ReconcileResult(0, 0, 0, List.of());
    }
}
