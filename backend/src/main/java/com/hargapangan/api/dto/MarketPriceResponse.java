package com.hargapangan.api.dto;

import com.hargapangan.domain.MarketPriceReport;
import com.hargapangan.market.ResolvedCommodity;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Locale;

/**
 * Market report with its commodity resolved from whichever registry the reference points into.
 * commodityName is null when the referenced commodity no longer exists.
 */
public record MarketPriceResponse(
        String id,
        String commoditySource,
        String commodityId,
        String commodityName,
        String commodityCategory,
        String marketName,
        String marketType,
        String marketLocation,
        String provinceName,
        String cityName,
        BigDecimal price,
        String unit,
        String qualityGrade,
        LocalDate dateRecorded,
        LocalTime timeRecorded,
        String primaryImage,
        List<String> additionalImages,
        String notes,
        String entrySource,
        String importBatchId,
        String verificationStatus,
        String verifiedBy,
        Instant verifiedAt,
        String reportedBy,
        Double latitude,
        Double longitude,
        Instant createdAt,
        Instant updatedAt
) {
    public static MarketPriceResponse from(MarketPriceReport r, ResolvedCommodity commodity) {
        return new MarketPriceResponse(
                r.getId(),
                r.getCommoditySource(),
                r.getCommodityId(),
                commodity != null ? commodity.name() : null,
                commodity != null ? commodity.category() : null,
                r.getMarketName(),
                lower(r.getMarketType()),
                r.getMarketLocation(),
                r.getProvinceName(),
                r.getCityName(),
                r.getPrice(),
                r.getUnit(),
                lower(r.getQualityGrade()),
                r.getDateRecorded(),
                r.getTimeRecorded(),
                r.getPrimaryImage(),
                r.getAdditionalImages(),
                r.getNotes(),
                lower(r.getEntrySource()),
                r.getImportBatchId(),
                lower(r.getVerificationStatus()),
                r.getVerifiedBy(),
                r.getVerifiedAt(),
                r.getReportedBy(),
                r.getLatitude(),
                r.getLongitude(),
                r.getCreatedAt(),
                r.getUpdatedAt());
    }

    private static String lower(Enum<?> value) {
        return value != null ? value.name().toLowerCase(Locale.ROOT) : null;
    }
}
