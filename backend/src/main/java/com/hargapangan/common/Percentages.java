package com.hargapangan.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Percentage arithmetic shared by override approval and comparison views.
 */
public final class Percentages {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Percentages() {
    }

    /**
     * (to - from) / from * 100, rounded to 2 dp. Zero when from is null or zero.
     */
    public static BigDecimal change(BigDecimal from, BigDecimal to) {
        if (from == null || to == null || from.signum() == 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return to.subtract(from)
                .multiply(HUNDRED)
                .divide(from, 2, RoundingMode.HALF_UP);
    }

    /** |change(from, to)|. */
    public static BigDecimal absoluteChange(BigDecimal from, BigDecimal to) {
        return change(from, to).abs();
    }

    /** Unrounded |to - from| / from * 100 at 6 dp, for threshold comparisons. */
    public static BigDecimal precise(BigDecimal from, BigDecimal to) {
        if (from == null || to == null || from.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return to.subtract(from).abs()
                .multiply(HUNDRED)
                .divide(from, 6, RoundingMode.HALF_UP);
    }
}
