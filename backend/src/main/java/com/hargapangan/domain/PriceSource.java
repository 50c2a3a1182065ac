package com.hargapangan.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a ledger price: synced from the upstream API or entered manually.
 */
public enum PriceSource {
    API("api"),
    MANUAL("manual");

    private final String code;

    PriceSource(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
