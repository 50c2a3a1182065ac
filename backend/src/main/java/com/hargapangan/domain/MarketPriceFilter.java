package com.hargapangan.domain;

import java.time.LocalDate;

/**
 * Optional filters for market report search; null fields are ignored. Text fields match as
 * case-insensitive substrings.
 */
public record MarketPriceFilter(
        MarketPriceReport.MarketType marketType,
        MarketPriceReport.QualityGrade qualityGrade,
        MarketPriceReport.VerificationStatus verificationStatus,
        MarketPriceReport.EntrySource entrySource,
        String commodityId,
        String provinceName,
        String cityName,
        String marketName,
        LocalDate from,
        LocalDate to
) {
    public static MarketPriceFilter none() {
        return new MarketPriceFilter(null, null, null, null, null, null, null, null, null, null);
    }
}
