package com.hargapangan.ingestion.adapter;

import java.util.List;

/**
 * Read-only client for the national price information API. Implementations retry and throttle;
 * they never persist anything.
 */
public interface PriceInformationClient {

    /**
     * Current price snapshot for the given filter.
     *
     * @throws UpstreamUnavailableException when every attempt failed
     */
    List<PriceSnapshot> fetchPriceInformation(PriceQuery query);

    /**
     * @throws UpstreamUnavailableException when every attempt failed
     */
    List<RegionSnapshot> fetchProvinces();

    /**
     * @throws UpstreamUnavailableException when every attempt failed
     */
    List<RegionSnapshot> fetchCities(int provinceId);
}
