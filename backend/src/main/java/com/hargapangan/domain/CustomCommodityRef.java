package com.hargapangan.domain;

/**
 * Points at a {@link CustomCommodity}.
 */
public record CustomCommodityRef(String customCommodityId) implements CommodityRef {

    @Override
    public String id() {
        return customCommodityId;
    }

    @Override
    public String sourceCode() {
        return "custom";
    }
}
