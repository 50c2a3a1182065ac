package com.hargapangan.ingestion.job;

import com.hargapangan.ingestion.config.SyncProperties;

/**
 * Parameters of one sync cycle.
 */
public record SyncOptions(String provinceId, String cityId, int levelHargaId, boolean syncRegions) {

    public static SyncOptions from(SyncProperties properties) {
        return new SyncOptions(properties.getProvinceId(), properties.getCityId(),
                properties.getLevelHargaId(), properties.isSyncRegions());
    }

    /** Copy with the non-null arguments replacing the current values. */
    public SyncOptions with(String provinceId, String cityId, Integer levelHargaId, Boolean syncRegions) {
        return new SyncOptions(
                provinceId != null ? provinceId : this.provinceId,
                cityId != null ? cityId : this.cityId,
                levelHargaId != null ? levelHargaId : this.levelHargaId,
                syncRegions != null ? syncRegions : this.syncRegions);
    }
}
