package com.hargapangan.api.dto;

import com.hargapangan.domain.Region;

public record RegionResponse(String id, Integer provinceId, String provinceName, Integer cityId, String cityName, String level) {

    public static RegionResponse from(Region r) {
        return new RegionResponse(r.getId(), r.getProvinceId(), r.getProvinceName(), r.getCityId(), r.getCityName(),
                r.getLevel() != null ? r.getLevel().getCode() : null);
    }
}
