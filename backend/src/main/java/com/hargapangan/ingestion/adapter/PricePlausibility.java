package com.hargapangan.ingestion.adapter;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Sanity band for upstream prices: usable iff present, positive and within [100, 1,000,000] inclusive.
 */
public final class PricePlausibility {

    public static final BigDecimal MIN_PRICE = BigDecimal.valueOf(100);
    public static final BigDecimal MAX_PRICE = BigDecimal.valueOf(1_000_000);

    private PricePlausibility() {
    }

    public static boolean isPlausible(BigDecimal price) {
        return price != null
                && price.signum() > 0
                && price.compareTo(MIN_PRICE) >= 0
                && price.compareTo(MAX_PRICE) <= 0;
    }

    /** Today's price when plausible, otherwise yesterday's when plausible, otherwise empty. */
    public static Optional<BigDecimal> effectivePrice(PriceSnapshot snapshot) {
        if (snapshot == null) {
            return Optional.empty();
        }
        if (isPlausible(snapshot.priceToday())) {
            return Optional.of(snapshot.priceToday());
        }
        if (isPlausible(snapshot.priceYesterday())) {
            return Optional.of(snapshot.priceYesterday());
        }
        return Optional.empty();
    }
}
