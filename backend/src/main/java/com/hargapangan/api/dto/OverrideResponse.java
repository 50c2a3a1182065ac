package com.hargapangan.api.dto;

import com.hargapangan.domain.PriceOverride;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;

public record OverrideResponse(
        String id,
        String pricePointId,
        String commodityId,
        LocalDate date,
        String regionId,
        BigDecimal originalPrice,
        String originalSource,
        BigDecimal requestedPrice,
        String reason,
        String sourceInfo,
        String evidenceRef,
        String requestedBy,
        String approvedBy,
        String status,
        String rejectionReason,
        Instant expiresAt,
        Instant createdAt,
        Instant decidedAt
) {
    public static OverrideResponse from(PriceOverride o) {
        return new OverrideResponse(
                o.getId(),
                o.getPricePointId(),
                o.getCommodityId(),
                o.getDate(),
                o.getRegionId(),
                o.getOriginalPrice(),
                o.getOriginalSource() != null ? o.getOriginalSource().getCode() : null,
                o.getRequestedPrice(),
                o.getReason(),
                o.getSourceInfo(),
                o.getEvidenceRef(),
                o.getRequestedBy(),
                o.getApprovedBy(),
                o.getStatus() != null ? o.getStatus().name().toLowerCase(Locale.ROOT) : null,
                o.getRejectionReason(),
                o.getExpiresAt(),
                o.getCreatedAt(),
                o.getDecidedAt());
    }
}
