package com.hargapangan.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for price_points (the price ledger).
 */
public interface PricePointRepository extends MongoRepository<PricePoint, String>, PricePointRepositoryCustom {

    /** Automatic row lookup used by reconciliation; regionId null matches the national row. */
    Optional<PricePoint> findByCommodityIdAndDateAndRegionIdAndSourceAndLevel(
            String commodityId, LocalDate date, String regionId, PriceSource source, PriceLevel level);

    /** Any override-flagged row for the key, regardless of level. */
    boolean existsByCommodityIdAndDateAndRegionIdAndOverrideTrue(String commodityId, LocalDate date, String regionId);

    /** Current price for an override request: newest row first. */
    Optional<PricePoint> findFirstByCommodityIdAndDateAndRegionIdOrderByUpdatedAtDesc(
            String commodityId, LocalDate date, String regionId);

    List<PricePoint> findByDateOrderByCommodityIdAsc(LocalDate date);

    List<PricePoint> findByDateAndCommodityIdIn(LocalDate date, Collection<String> commodityIds);

    List<PricePoint> findByCommodityIdAndDateBetweenOrderByDateAsc(String commodityId, LocalDate from, LocalDate to);

    List<PricePoint> findByCommodityIdAndRegionIdAndDateBetweenOrderByDateAsc(
            String commodityId, String regionId, LocalDate from, LocalDate to);

    List<PricePoint> findByDateBetweenOrderByDateAsc(LocalDate from, LocalDate to);

    List<PricePoint> findByDateBetweenOrderByDateDescCommodityIdAsc(LocalDate from, LocalDate to);
}
