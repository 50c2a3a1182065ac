package com.hargapangan.domain;

/**
 * Points at a {@link Commodity} in the national registry.
 */
public record NationalCommodityRef(String commodityId) implements CommodityRef {

    @Override
    public String id() {
        return commodityId;
    }

    @Override
    public String sourceCode() {
        return "national";
    }
}
