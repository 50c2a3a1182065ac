package com.hargapangan.comparison;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One ledger price of the day with the previous day's price. trend is up, down or stable.
 */
public record CurrentPriceRow(
        String id,
        CommoditySummary commodity,
        BigDecimal price,
        BigDecimal yesterdayPrice,
        BigDecimal gap,
        BigDecimal gapPct,
        String trend,
        String source,
        boolean override,
        String level,
        String regionId,
        LocalDate date
) {
}
