package com.hargapangan.domain;

import java.time.LocalDate;

/**
 * Application event: price_points changed for the given date (sync write or override apply/revert).
 * Published by ingestion and override; consumed by comparison to drop cached views.
 */
public record PriceLedgerChangedEvent(LocalDate date, String reason) {
}
