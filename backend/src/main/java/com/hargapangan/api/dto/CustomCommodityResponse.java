package com.hargapangan.api.dto;

import com.hargapangan.domain.CustomCommodity;

import java.time.Instant;

public record CustomCommodityResponse(String id, String name, String unit, String category, String description,
                                      String createdBy, boolean active, Instant createdAt, Instant updatedAt) {

    public static CustomCommodityResponse from(CustomCommodity c) {
        return new CustomCommodityResponse(c.getId(), c.getName(), c.getUnit(), c.getCategory(), c.getDescription(),
                c.getCreatedBy(), c.isActive(), c.getCreatedAt(), c.getUpdatedAt());
    }
}
