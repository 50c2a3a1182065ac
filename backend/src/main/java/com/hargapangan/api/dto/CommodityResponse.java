package com.hargapangan.api.dto;

import com.hargapangan.domain.Commodity;

import java.time.Instant;

public record CommodityResponse(String id, Integer externalId, String name, String unit, String category,
                                String iconUrl, boolean active, Instant createdAt, Instant updatedAt) {

    public static CommodityResponse from(Commodity c) {
        return new CommodityResponse(c.getId(), c.getExternalId(), c.getName(), c.getUnit(),
                c.getCategory() != null ? c.getCategory().getCode() : null,
                c.getIconUrl(), c.isActive(), c.getCreatedAt(), c.getUpdatedAt());
    }
}
