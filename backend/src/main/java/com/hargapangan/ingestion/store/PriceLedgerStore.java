package com.hargapangan.ingestion.store;

import com.hargapangan.domain.PriceLevel;
import com.hargapangan.domain.PricePoint;
import com.hargapangan.domain.PricePointRepository;
import com.hargapangan.domain.PriceSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Writes automatic (source=api) ledger rows keyed by (commodityId, date, regionId, source, level).
 * The unique index on that key is authoritative: an insert that loses a race is retried once as an update.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceLedgerStore {

    private final PricePointRepository repository;
    private final Clock clock;

    /** True when any override-flagged row exists for (commodity, date, region), regardless of level. */
    public boolean hasOverride(String commodityId, LocalDate date, String regionId) {
        return repository.existsByCommodityIdAndDateAndRegionIdAndOverrideTrue(commodityId, date, regionId);
    }

    public Optional<PricePoint> findAutomatic(String commodityId, LocalDate date, String regionId, PriceLevel level) {
        return repository.findByCommodityIdAndDateAndRegionIdAndSourceAndLevel(
                commodityId, date, regionId, PriceSource.API, level);
    }

    /**
     * Insert-or-update of the automatic row. Equal price means no write.
     */
    public WriteResult upsertAutomatic(String commodityId, LocalDate date, String regionId, PriceLevel level, BigDecimal price) {
        Optional<PricePoint> existing = findAutomatic(commodityId, date, regionId, level);
        if (existing.isPresent()) {
            return updateIfChanged(existing.get(), price);
        }
        PricePoint row = new PricePoint();
        row.setCommodityId(commodityId);
        row.setDate(date);
        row.setRegionId(regionId);
        row.setLevel(level);
        row.setSource(PriceSource.API);
        row.setOverride(false);
        row.setPrice(price);
        Instant now = Instant.now(clock);
        row.setCreatedAt(now);
        row.setUpdatedAt(now);
        try {
            return WriteResult.inserted(repository.insert(row));
        } catch (DuplicateKeyException e) {
            log.debug("Ledger row for commodity {} on {} inserted concurrently; retrying as update", commodityId, date);
            PricePoint winner = findAutomatic(commodityId, date, regionId, level)
                    .orElseThrow(() -> e);
            return updateIfChanged(winner, price);
        }
    }

    private WriteResult updateIfChanged(PricePoint row, BigDecimal price) {
        BigDecimal previous = row.getPrice();
        if (previous != null && previous.compareTo(price) == 0) {
            return WriteResult.unchanged(row);
        }
        row.setPrice(price);
        row.setUpdatedAt(Instant.now(clock));
        return WriteResult.updated(repository.save(row), previous);
    }

    /**
     * @param previousPrice price before an update; null for inserts and unchanged rows
     */
    public record WriteResult(PricePoint row, Outcome outcome, BigDecimal previousPrice) {

        public enum Outcome { INSERTED, UPDATED, UNCHANGED }

        static WriteResult inserted(PricePoint row) {
            return new WriteResult(row, Outcome.INSERTED, null);
        }

        static WriteResult updated(PricePoint row, BigDecimal previous) {
            return new WriteResult(row, Outcome.UPDATED, previous);
        }

        static WriteResult unchanged(PricePoint row) {
            return new WriteResult(row, Outcome.UNCHANGED, null);
        }

        public boolean wrote() {
            return outcome != Outcome.UNCHANGED;
        }
    }
}
