package com.hargapangan.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * Aggregate queries over price_points using MongoTemplate.
 */
public interface PricePointRepositoryCustom {

    /** avg/min/max/count per (commodity, level) for dates in [from, to], optionally restricted to a region. */
    List<CommodityPriceAggregate> aggregateByCommodity(LocalDate from, LocalDate to, String regionId);
}
