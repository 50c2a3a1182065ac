package com.hargapangan.ingestion.reconcile;

import com.hargapangan.common.Percentages;
import com.hargapangan.domain.Commodity;
import com.hargapangan.domain.PriceLedgerChangedEvent;
import com.hargapangan.domain.PriceLevel;
import com.hargapangan.ingestion.adapter.PricePlausibility;
import com.hargapangan.ingestion.adapter.PriceSnapshot;
import com.hargapangan.ingestion.registry.CommodityRegistry;
import com.hargapangan.ingestion.store.PriceLedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies an upstream snapshot to the national ledger (regionId null) for one date and level.
 * Manual data wins: a commodity with any override-flagged row for the date is left untouched.
 * Per-row failures are collected and never abort the batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceLedgerReconciler {

    static final int MAX_REPORTED_ERRORS = 5;
    static final BigDecimal NOTABLE_CHANGE_PCT = BigDecimal.valueOf(5);

    private final CommodityRegistry commodityRegistry;
    private final PriceLedgerStore ledgerStore;
    private final ApplicationEventPublisher applicationEventPublisher;

    public ReconcileResult reconcile(LocalDate date, PriceLevel level, List<PriceSnapshot> snapshots) {
        if (snapshots == null || snapshots.isEmpty()) {
            return ReconcileResult.empty();
        }
        int saved = 0;
        int skipped = 0;
        int written = 0;
        List<String> errors = new ArrayList<>();
        int errorCount = 0;
        for (PriceSnapshot snapshot : snapshots) {
            try {
                Optional<Commodity> commodity = commodityRegistry.resolve(snapshot);
                if (commodity.isEmpty()) {
                    log.debug("Skipping snapshot row without upstream id: {}", snapshot);
                    skipped++;
                    continue;
                }
                Optional<BigDecimal> price = PricePlausibility.effectivePrice(snapshot);
                if (price.isEmpty()) {
                    log.warn("Skipping {} - no plausible price (today: {}, yesterday: {})",
                            snapshot.name(), snapshot.priceToday(), snapshot.priceYesterday());
                    skipped++;
                    continue;
                }
                String commodityId = commodity.get().getId();
                if (ledgerStore.hasOverride(commodityId, date, null)) {
                    log.info("Skipping {} on {} - manual override exists", commodity.get().getName(), date);
                    skipped++;
                    continue;
                }
                PriceLedgerStore.WriteResult result = ledgerStore.upsertAutomatic(commodityId, date, null, level, price.get());
                if (result.outcome() == PriceLedgerStore.WriteResult.Outcome.UPDATED) {
                    logNotableChange(commodity.get(), result.previousPrice(), price.get());
                }
                if (result.wrote()) {
                    written++;
                }
                saved++;
            } catch (Exception e) {
                errorCount++;
                String message = "Error syncing price for " + (snapshot != null && snapshot.name() != null ? snapshot.name() : "unknown")
                        + ": " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                log.error(message, e);
                if (errors.size() < MAX_REPORTED_ERRORS) {
                    errors.add(message);
                }
            }
        }
        if (written > 0) {
            applicationEventPublisher.publishEvent(new PriceLedgerChangedEvent(date, "sync"));
        }
        log.info("Reconciled {} rows for {} level {}: saved={}, written={}, skipped={}, errors={}",
                snapshots.size(), date, level, saved, written, skipped, errorCount);
        return new ReconcileResult(saved, skipped, errorCount, List.copyOf(errors));
    }

    private static void logNotableChange(Commodity commodity, BigDecimal previous, BigDecimal current) {
        BigDecimal changePct = Percentages.precise(previous, current);
        if (changePct.compareTo(NOTABLE_CHANGE_PCT) > 0) {
            log.info("Notable price change for {}: {} -> {} ({}%)", commodity.getName(), previous, current,
                    Percentages.change(previous, current));
        }
    }
}
