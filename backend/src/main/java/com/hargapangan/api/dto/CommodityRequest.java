package com.hargapangan.api.dto;

import com.hargapangan.api.validation.CategoryCode;
import jakarta.validation.constraints.NotBlank;

/**
 * POST/PUT /api/v1/commodities body.
 */
public record CommodityRequest(
        Integer externalId,

        @NotBlank(message = "INVALID_COMMODITY")
        String name,

        String unit,

        @CategoryCode
        String category,

        String iconUrl
) {
}
