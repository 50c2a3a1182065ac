package com.hargapangan.market;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * New market report. commodityType "existing" uses commodityId (optionally with commoditySource
 * national|custom); "new" uses commodityName, commodityUnit and commodityCategory.
 */
public record MarketPriceSubmission(
        String commodityType,
        String commodityId,
        String commoditySource,
        String commodityName,
        String commodityUnit,
        String commodityCategory,
        String marketName,
        String marketType,
        String marketLocation,
        String provinceName,
        String cityName,
        BigDecimal price,
        String qualityGrade,
        LocalDate dateRecorded,
        LocalTime timeRecorded,
        String primaryImage,
        List<String> additionalImages,
        String notes,
        Double latitude,
        Double longitude
) {
}
