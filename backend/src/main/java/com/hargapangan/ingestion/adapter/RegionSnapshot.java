package com.hargapangan.ingestion.adapter;

/**
 * Province or city as listed by the upstream.
 */
public record RegionSnapshot(Integer id, String name) {
}
