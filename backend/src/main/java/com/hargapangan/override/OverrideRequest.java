package com.hargapangan.override;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Input of {@link OverrideService#create}. regionId null targets the national row.
 */
public record OverrideRequest(
        String commodityId,
        LocalDate date,
        String regionId,
        BigDecimal requestedPrice,
        String reason,
        String sourceInfo,
        String evidenceRef
) {
}
