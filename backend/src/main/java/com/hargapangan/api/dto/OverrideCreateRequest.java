package com.hargapangan.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * POST /api/v1/overrides request body. date defaults to today (Asia/Jakarta). requestedPrice is checked by
 * OverrideService so that rejected attempts are audited.
 */
public record OverrideCreateRequest(
        @NotBlank(message = "COMMODITY_NOT_FOUND")
        String commodityId,

        LocalDate date,

        String regionId,

        BigDecimal requestedPrice,

        @NotBlank(message = "VALIDATION_ERROR")
        String reason,

        String sourceInfo,

        String evidenceRef
) {
}
