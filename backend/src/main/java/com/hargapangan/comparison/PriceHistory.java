package com.hargapangan.comparison;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Price series of one commodity over a window, oldest first, with summary stats.
 */
public record PriceHistory(CommoditySummary commodity, LocalDate from, LocalDate to, List<Point> series, Stats stats) {

    public record Point(LocalDate date, BigDecimal price, String source, boolean override, String level) {
    }

    /** All zero for an empty series. changePct is first to last. */
    public record Stats(BigDecimal min, BigDecimal max, BigDecimal avg, BigDecimal current, BigDecimal changePct) {
    }
}
