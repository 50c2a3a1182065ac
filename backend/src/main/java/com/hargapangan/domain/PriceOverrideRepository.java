package com.hargapangan.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Persistence for price_overrides.
 */
public interface PriceOverrideRepository extends MongoRepository<PriceOverride, String>, PriceOverrideRepositoryCustom {

    /** Used for 409 OVERRIDE_EXISTS: an open override already targets the price point. */
    boolean existsByPricePointIdAndStatusIn(String pricePointId, Collection<PriceOverride.Status> statuses);

    /** Expiry sweep: open overrides whose expiresAt has passed. */
    List<PriceOverride> findByStatusInAndExpiresAtBefore(Collection<PriceOverride.Status> statuses, Instant cutoff);

    /** Applied overrides for the given ledger rows; used to recover the automatic price in comparisons. */
    List<PriceOverride> findByPricePointIdInAndStatus(Collection<String> pricePointIds, PriceOverride.Status status);
}
