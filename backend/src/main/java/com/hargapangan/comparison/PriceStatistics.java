package com.hargapangan.comparison;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Aggregates per commodity and price level for a period plus the period's top movers.
 */
public record PriceStatistics(String period, LocalDate from, LocalDate to, List<CommodityStats> statistics, List<TopMover> topMovers) {

    public record CommodityStats(CommoditySummary commodity, String level, BigDecimal avgPrice, BigDecimal minPrice, BigDecimal maxPrice,
                                 long dataPoints) {
    }
}
