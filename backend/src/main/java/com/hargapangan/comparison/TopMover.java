package com.hargapangan.comparison;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Change of one commodity at one price level between its first and last price inside a window.
 */
public record TopMover(
        CommoditySummary commodity,
        String level,
        LocalDate startDate,
        BigDecimal startPrice,
        LocalDate endDate,
        BigDecimal endPrice,
        BigDecimal changePct
) {
}
