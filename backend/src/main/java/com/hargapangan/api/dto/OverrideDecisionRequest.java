package com.hargapangan.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * PATCH /api/v1/overrides/{id}/status body: status approved|rejected.
 */
public record OverrideDecisionRequest(
        @NotBlank(message = "INVALID_DECISION")
        String status,

        String rejectionReason
) {
}
