package com.hargapangan.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Supply-chain stage a price is quoted at. Upstream level ids: 1=produsen, 2=grosir, 3=konsumen.
 */
public enum PriceLevel {
    PRODUSEN("produsen"),
    GROSIR("grosir"),
    ECERAN("eceran"),
    KONSUMEN("konsumen");

    private final String code;

    PriceLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /** Maps the upstream level_harga_id; anything other than 1 or 2 is the consumer level. */
    public static PriceLevel fromUpstreamLevelId(int levelHargaId) {
        return switch (levelHargaId) {
            case 1 -> PRODUSEN;
            case 2 -> GROSIR;
            default -> KONSUMEN;
        };
    }

    public static PriceLevel fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (PriceLevel l : values()) {
            if (l.code.equalsIgnoreCase(code.strip()) || l.name().equalsIgnoreCase(code.strip())) {
                return l;
            }
        }
        return null;
    }
}
