package com.hargapangan.market;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Report counts by verification status and market type, and average price per commodity.
 */
public record MarketPriceStats(
        long total,
        Map<String, Long> byVerificationStatus,
        Map<String, Long> byMarketType,
        List<CommodityAverage> averages
) {
    public record CommodityAverage(String commoditySource, String commodityId, String commodityName, BigDecimal avgPrice, long reports) {
    }
}
