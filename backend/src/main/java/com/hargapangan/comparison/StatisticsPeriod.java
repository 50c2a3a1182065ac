package com.hargapangan.comparison;

import java.util.Locale;

/**
 * Statistics window ending today. Unknown or missing values fall back to seven days.
 */
public enum StatisticsPeriod {
    LAST_24H("24h", 1),
    LAST_7D("7d", 7),
    LAST_30D("30d", 30),
    LAST_90D("90d", 90);

    private final String code;
    private final int days;

    StatisticsPeriod(String code, int days) {
        this.code = code;
        this.days = days;
    }

    public String getCode() {
        return code;
    }

    public int getDays() {
        return days;
    }

    public static StatisticsPeriod fromCode(String code) {
        if (code == null) {
            return LAST_7D;
        }
        String c = code.strip().toLowerCase(Locale.ROOT);
        for (StatisticsPeriod p : values()) {
            if (p.code.equals(c)) {
                return p;
            }
        }
        return LAST_7D;
    }
}
