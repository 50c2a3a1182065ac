package com.hargapangan.common;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class PercentagesTest {

    @Test
    void changeIsRoundedToTwoDecimals() {
        assertThat(Percentages.change(new BigDecimal("12000"), new BigDecimal("12500"))).isEqualByComparingTo("4.17");
        assertThat(Percentages.change(new BigDecimal("20000"), new BigDecimal("19000"))).isEqualByComparingTo("-5.00");
    }

    @Test
    void changeFromZeroOrMissingIsZero() {
        assertThat(Percentages.change(BigDecimal.ZERO, new BigDecimal("100"))).isEqualByComparingTo("0");
        assertThat(Percentages.change(null, new BigDecimal("100"))).isEqualByComparingTo("0");
    }

    @Test
    void preciseKeepsSixDecimalsAndIsAbsolute() {
        assertThat(Percentages.precise(new BigDecimal("12500"), new BigDecimal("18750.01"))).isEqualByComparingTo("50.000080");
        assertThat(Percentages.precise(new BigDecimal("12500"), new BigDecimal("6250"))).isEqualByComparingTo("50");
    }
}
