package com.hargapangan.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * PATCH /api/v1/market-prices/{id}/verification body: status pending|verified|rejected.
 */
public record VerificationRequest(
        @NotBlank(message = "VALIDATION_FAILED")
        String status
) {
}
