package com.hargapangan.ingestion.adapter;

import java.math.BigDecimal;

/**
 * One commodity row of an upstream price snapshot. Any field may be null when the upstream omits it.
 */
public record PriceSnapshot(
        Integer externalId,
        String name,
        String unit,
        String iconUrl,
        BigDecimal priceToday,
        BigDecimal priceYesterday
) {
}
