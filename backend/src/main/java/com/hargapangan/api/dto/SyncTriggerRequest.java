package com.hargapangan.api.dto;

/**
 * Optional POST /api/v1/sync/trigger body; null fields fall back to the configured defaults.
 */
public record SyncTriggerRequest(String provinceId, String cityId, Integer levelHargaId, Boolean syncRegions) {
}
