package com.hargapangan.domain;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.util.List;

/**
 * Filtered search and aggregates over market_price_reports.
 */
public interface MarketPriceReportRepositoryCustom {

    Page<MarketPriceReport> search(MarketPriceFilter filter, Pageable pageable);

    /** Average price per (commoditySource, commodityId) over active reports. */
    List<CommodityAverage> averagePriceByCommodity();

    record CommodityAverage(String commoditySource, String commodityId, BigDecimal avgPrice, long reports) {
    }
}
