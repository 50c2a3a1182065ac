package com.hargapangan.domain;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.LocalDate;

/**
 * Filtered, paged override listing.
 */
public interface PriceOverrideRepositoryCustom {

    /** All filters optional; newest createdAt first. */
    Page<PriceOverride> search(PriceOverride.Status status, String commodityId, LocalDate from, LocalDate to, Pageable pageable);
}
