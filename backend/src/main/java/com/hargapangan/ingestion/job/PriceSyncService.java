package com.hargapangan.ingestion.job;

import com.hargapangan.audit.Actor;
import com.hargapangan.audit.AuditActions;
import com.hargapangan.audit.AuditLogService;
import com.hargapangan.domain.PriceLevel;
import com.hargapangan.ingestion.adapter.PriceInformationClient;
import com.hargapangan.ingestion.adapter.PriceQuery;
import com.hargapangan.ingestion.adapter.PriceSnapshot;
import com.hargapangan.ingestion.adapter.UpstreamUnavailableException;
import com.hargapangan.ingestion.reconcile.PriceLedgerReconciler;
import com.hargapangan.ingestion.reconcile.ReconcileResult;
import com.hargapangan.ingestion.region.RegionSyncService;
import com.hargapangan.override.OverrideService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One sync cycle: optional region refresh, upstream snapshot fetch, ledger reconciliation for today
 * in the configured zone, then the override expiry sweep. An unreachable upstream ends the cycle
 * without touching stored prices.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceSyncService {

    private static final String ENTITY = "price_sync";

    private final PriceInformationClient client;
    private final PriceLedgerReconciler reconciler;
    private final RegionSyncService regionSyncService;
    private final OverrideService overrideService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public SyncCycleResult runCycle(SyncOptions options, Actor actor) {
        Instant startedAt = Instant.now(clock);
        LocalDate date = LocalDate.now(clock);
        PriceLevel level = PriceLevel.fromUpstreamLevelId(options.levelHargaId());
        log.info("Starting price sync for {} (province='{}', city='{}', level={})",
                date, options.provinceId(), options.cityId(), level.getCode());

        int regionsCreated = options.syncRegions() ? syncRegions(options.provinceId()) : 0;

        List<PriceSnapshot> snapshots;
        try {
            snapshots = client.fetchPriceInformation(new PriceQuery(options.provinceId(), options.cityId(), options.levelHargaId()));
        } catch (UpstreamUnavailableException e) {
            log.error("Price sync aborted: {}", e.getMessage());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error", e.getMessage());
            details.put("attempts", e.getAttempts());
            auditLogService.record(actor, AuditActions.SYNC_ERROR, ENTITY, date.toString(), null, details);
            return new SyncCycleResult(false, "Sync failed: " + e.getMessage(), date, level.getCode(), 0,
                    regionsCreated, 0, null, startedAt, Instant.now(clock));
        }

        ReconcileResult result = reconciler.reconcile(date, level, snapshots);
        int expired = overrideService.expireDue();
        Instant finishedAt = Instant.now(clock);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("received", snapshots.size());
        details.put("saved", result.savedCount());
        details.put("skipped", result.skippedCount());
        details.put("errors", result.errorCount());
        details.put("overridesExpired", expired);
        auditLogService.record(actor, AuditActions.SYNC_COMPLETED, ENTITY, date.toString(), null, details);

        String message = String.format("Sync completed: %d received, %d saved, %d skipped, %d errors",
                snapshots.size(), result.savedCount(), result.skippedCount(), result.errorCount());
        log.info("{} in {} ms", message, finishedAt.toEpochMilli() - startedAt.toEpochMilli());
        return new SyncCycleResult(true, message, date, level.getCode(), snapshots.size(), regionsCreated,
                expired, result, startedAt, finishedAt);
    }

    /** Provinces, plus the cities of the selected province when one is set. */
    private int syncRegions(String provinceId) {
        int created = regionSyncService.syncProvinces();
        if (provinceId != null && !provinceId.isBlank()) {
            try {
                created += regionSyncService.syncCities(Integer.parseInt(provinceId.strip()));
            } catch (NumberFormatException e) {
                log.warn("City sync skipped: province id '{}' is not numeric", provinceId);
            }
        }
        return created;
    }
}
