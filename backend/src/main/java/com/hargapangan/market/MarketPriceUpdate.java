package com.hargapangan.market;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Partial update of a market report; null fields are left unchanged. addImages are appended in
 * order, removeImages are dropped by reference (and deleted from storage).
 */
public record MarketPriceUpdate(
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
        List<String> addImages,
        List<String> removeImages,
        String notes,
        Double latitude,
        Double longitude
) {
}
