package com.hargapangan.ingestion.adapter;

/**
 * Filter for the price information endpoint. Empty province/city means national.
 */
public record PriceQuery(String provinceId, String cityId, int levelHargaId) {

    public PriceQuery {
        provinceId = provinceId == null ? "" : provinceId.strip();
        cityId = cityId == null ? "" : cityId.strip();
    }

    public static PriceQuery national(int levelHargaId) {
        return new PriceQuery("", "", levelHargaId);
    }
}
