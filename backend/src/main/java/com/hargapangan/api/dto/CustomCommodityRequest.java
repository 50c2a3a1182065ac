package com.hargapangan.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST/PUT /api/v1/custom-commodities body. category is free text.
 */
public record CustomCommodityRequest(
        @NotBlank(message = "VALIDATION_FAILED")
        String name,

        @NotBlank(message = "VALIDATION_FAILED")
        String unit,

        String category,

        String description
) {
}
