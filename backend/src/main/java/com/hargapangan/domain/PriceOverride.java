package com.hargapangan.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Manual correction of a ledger price. Stored in price_overrides. While APPROVED the target
 * PricePoint carries source=manual and override=true; originalPrice/originalSource allow the revert.
 */
@Document(collection = "price_overrides")
@CompoundIndex(name = "status_expires", def = "{'status': 1, 'expiresAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PriceOverride {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String pricePointId;
    private String commodityId;
    private LocalDate date;
    private String regionId;
    private BigDecimal originalPrice;
    private PriceSource originalSource;
    private BigDecimal requestedPrice;
    private String reason;
    private String sourceInfo;
    private String evidenceRef;
    private String requestedBy;
    private String approvedBy;
    private Status status;
    private String rejectionReason;
    private Instant expiresAt;
    private Instant createdAt;
    private Instant decidedAt;

    public enum Status {
        PENDING,
        APPROVED,
        REJECTED,
        EXPIRED
    }
}
