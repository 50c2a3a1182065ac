package com.hargapangan.domain;

import java.math.BigDecimal;

/**
 * Aggregation row over price_points grouped by commodity and price level.
 */
public record CommodityPriceAggregate(
        String commodityId,
        PriceLevel level,
        BigDecimal avgPrice,
        BigDecimal minPrice,
        BigDecimal maxPrice,
        long dataPoints
) {
}
