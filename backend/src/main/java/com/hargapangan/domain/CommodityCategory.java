package com.hargapangan.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * National commodity grouping. Stored and serialised by its lower-case code.
 */
public enum CommodityCategory {
    BERAS("beras"),
    SAYURAN("sayuran"),
    DAGING("daging"),
    BUMBU("bumbu"),
    LAINNYA("lainnya");

    private final String code;

    CommodityCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * @return the category for the given code (any case), or {@code null} when unknown
     */
    public static CommodityCategory fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (CommodityCategory c : values()) {
            if (c.code.equalsIgnoreCase(code.strip()) || c.name().equalsIgnoreCase(code.strip())) {
                return c;
            }
        }
        return null;
    }
}
