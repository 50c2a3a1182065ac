package com.hargapangan.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Reference from a market price report to either the national registry or a custom commodity.
 * Each variant is resolved through its own repository.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "source")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NationalCommodityRef.class, name = "national"),
        @JsonSubTypes.Type(value = CustomCommodityRef.class, name = "custom")
})
public sealed interface CommodityRef permits NationalCommodityRef, CustomCommodityRef {

    String id();

    /** "national" or "custom"; also the CSV commodity_source value. */
    String sourceCode();

    static CommodityRef of(String sourceCode, String id) {
        if ("custom".equalsIgnoreCase(sourceCode)) {
            return new CustomCommodityRef(id);
        }
        return new NationalCommodityRef(id);
    }
}
