package com.hargapangan.comparison;

import java.math.BigDecimal;

/**
 * Automatic vs manual price of one commodity at one price level on one day. delta and deltaPct are null unless both
 * prices exist.
 */
public record DayComparisonRow(
        CommoditySummary commodity,
        String level,
        BigDecimal apiPrice,
        BigDecimal manualPrice,
        BigDecimal activePrice,
        BigDecimal delta,
        BigDecimal deltaPct
) {
}
